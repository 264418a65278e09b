package com.example.shotforge_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit")
public class AuditProperties {
    private double passScore = 80.0;
    private int maxOptimizeIterations = 5;
    private double minImprovement = 2.0;

    public double getPassScore() {
        return passScore;
    }

    public void setPassScore(double passScore) {
        this.passScore = passScore;
    }

    public int getMaxOptimizeIterations() {
        return maxOptimizeIterations;
    }

    public void setMaxOptimizeIterations(int maxOptimizeIterations) {
        this.maxOptimizeIterations = maxOptimizeIterations;
    }

    /** Score gain above which an optimization round resets the stall counter. */
    public double getMinImprovement() {
        return minImprovement;
    }

    public void setMinImprovement(double minImprovement) {
        this.minImprovement = minImprovement;
    }
}
