package com.example.shotforge_backend.model;

/**
 * Frame-chaining state of a run. The seed is locked at the first start; the previous frame only
 * moves forward when a shot completes.
 */
public class ChainContext {
    private String previousFrameUrl;
    private Long seed;

    public ChainContext() {
    }

    public ChainContext(String previousFrameUrl, Long seed) {
        this.previousFrameUrl = previousFrameUrl;
        this.seed = seed;
    }

    public String getPreviousFrameUrl() {
        return previousFrameUrl;
    }

    public void setPreviousFrameUrl(String previousFrameUrl) {
        this.previousFrameUrl = previousFrameUrl;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }
}
