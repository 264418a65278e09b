package com.example.shotforge_backend.model;

import com.example.shotforge_backend.util.ShotStatus;
import com.example.shotforge_backend.util.TransitionType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * One planned clip. Created once by the script breakdown; {@code id} and {@code index} never change
 * and the shot is mutated in place through its state machine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Shot {
    private String id;
    private int index;
    private String title;
    private String description;
    private String dialogue;
    private String mood;
    private String cameraMovement;
    private TransitionType transitionOut = TransitionType.CONTINUOUS;
    private int durationSeconds;
    private ShotStatus status = ShotStatus.PENDING;
    private String videoUrl;
    private String endFrameUrl;
    private int retryCount;
    private List<VisualDebugResult> visualDebugResults = new ArrayList<>();
    private String error;

    public Shot() {
    }

    public Shot(String id, int index) {
        this.id = id;
        this.index = index;
    }

    /**
     * Two-digit shot id, for shot lists shorter than 100.
     */
    public static String idForIndex(int index) {
        return idForIndex(index, 0);
    }

    /**
     * Stable shot id for a position, zero-padded to the width of {@code shotCount} (at least two
     * digits) so ids sort as strings in index order: {@code S01} ... {@code S99}, or
     * {@code S001} ... {@code S120} in a list of 120.
     */
    public static String idForIndex(int index, int shotCount) {
        int width = Math.max(2, String.valueOf(Math.max(shotCount, index + 1)).length());
        return "S" + String.format("%0" + width + "d", index + 1);
    }

    public void recordAttempt(VisualDebugResult result) {
        visualDebugResults.add(result);
    }

    public VisualDebugResult lastAttempt() {
        return visualDebugResults.isEmpty() ? null : visualDebugResults.get(visualDebugResults.size() - 1);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getDialogue() {
        return dialogue;
    }

    public void setDialogue(String dialogue) {
        this.dialogue = dialogue;
    }

    public String getMood() {
        return mood;
    }

    public void setMood(String mood) {
        this.mood = mood;
    }

    public String getCameraMovement() {
        return cameraMovement;
    }

    public void setCameraMovement(String cameraMovement) {
        this.cameraMovement = cameraMovement;
    }

    public TransitionType getTransitionOut() {
        return transitionOut;
    }

    public void setTransitionOut(TransitionType transitionOut) {
        this.transitionOut = transitionOut;
    }

    public int getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(int durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public ShotStatus getStatus() {
        return status;
    }

    public void setStatus(ShotStatus status) {
        this.status = status;
    }

    public String getVideoUrl() {
        return videoUrl;
    }

    public void setVideoUrl(String videoUrl) {
        this.videoUrl = videoUrl;
    }

    public String getEndFrameUrl() {
        return endFrameUrl;
    }

    public void setEndFrameUrl(String endFrameUrl) {
        this.endFrameUrl = endFrameUrl;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public List<VisualDebugResult> getVisualDebugResults() {
        return visualDebugResults;
    }

    public void setVisualDebugResults(List<VisualDebugResult> visualDebugResults) {
        this.visualDebugResults = visualDebugResults == null ? new ArrayList<>() : new ArrayList<>(visualDebugResults);
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
