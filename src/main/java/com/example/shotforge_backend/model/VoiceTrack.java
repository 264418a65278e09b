package com.example.shotforge_backend.model;

import com.example.shotforge_backend.util.ShotStatus;

public class VoiceTrack {
    private String shotId;
    private ShotStatus status = ShotStatus.PENDING;
    private String audioUrl;

    public VoiceTrack() {
    }

    public VoiceTrack(String shotId) {
        this.shotId = shotId;
    }

    public String getShotId() {
        return shotId;
    }

    public void setShotId(String shotId) {
        this.shotId = shotId;
    }

    public ShotStatus getStatus() {
        return status;
    }

    public void setStatus(ShotStatus status) {
        this.status = status;
    }

    public String getAudioUrl() {
        return audioUrl;
    }

    public void setAudioUrl(String audioUrl) {
        this.audioUrl = audioUrl;
    }
}
