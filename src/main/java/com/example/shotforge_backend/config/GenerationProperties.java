package com.example.shotforge_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the generation service that fronts the script, vision, critique,
 * video, voice, visual-debugger and export models.
 */
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {
    private String baseUrl = "http://127.0.0.1:8100";
    private String apiKey;
    private long timeoutSeconds = 120;
    private long videoTimeoutSeconds = 600;
    private int connectTimeoutMillis = 15_000;
    private int maxRetries = 2;
    private long retryBackoffMillis = 500;
    private String voiceId = "narrator";
    private Paths paths = new Paths();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getVideoTimeoutSeconds() {
        return videoTimeoutSeconds;
    }

    public void setVideoTimeoutSeconds(long videoTimeoutSeconds) {
        this.videoTimeoutSeconds = videoTimeoutSeconds;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryBackoffMillis() {
        return retryBackoffMillis;
    }

    public void setRetryBackoffMillis(long retryBackoffMillis) {
        this.retryBackoffMillis = retryBackoffMillis;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public void setVoiceId(String voiceId) {
        this.voiceId = voiceId;
    }

    public Paths getPaths() {
        return paths;
    }

    public void setPaths(Paths paths) {
        this.paths = paths;
    }

    public static class Paths {
        private String script = "/v1/script";
        private String vision = "/v1/vision/character-bible";
        private String audit = "/v1/audit";
        private String video = "/v1/video";
        private String voice = "/v1/voice";
        private String visualDebugger = "/v1/visual-debugger";
        private String export = "/v1/export";
        private String health = "/health";

        public String getScript() {
            return script;
        }

        public void setScript(String script) {
            this.script = script;
        }

        public String getVision() {
            return vision;
        }

        public void setVision(String vision) {
            this.vision = vision;
        }

        public String getAudit() {
            return audit;
        }

        public void setAudit(String audit) {
            this.audit = audit;
        }

        public String getVideo() {
            return video;
        }

        public void setVideo(String video) {
            this.video = video;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public String getVisualDebugger() {
            return visualDebugger;
        }

        public void setVisualDebugger(String visualDebugger) {
            this.visualDebugger = visualDebugger;
        }

        public String getExport() {
            return export;
        }

        public void setExport(String export) {
            this.export = export;
        }

        public String getHealth() {
            return health;
        }

        public void setHealth(String health) {
            this.health = health;
        }
    }
}
