package com.example.shotforge_backend.model;

import com.example.shotforge_backend.util.RunStatus;
import com.example.shotforge_backend.util.ShotStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Run state of one project's production. Created when the audit is approved.
 * <p>
 * The shot list itself is persisted on {@link Project} and attached here when the state is read,
 * so there is exactly one copy of every shot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProductionState {
    @JsonIgnore
    private List<Shot> shots = new ArrayList<>();

    private int currentShotIndex;
    private MasterAnchor masterAnchor;
    private ChainContext chainContext = new ChainContext();
    private List<VoiceTrack> voiceTracks = new ArrayList<>();
    private QualityTier qualityTier = QualityTier.STANDARD;
    private boolean auditApproved;
    private boolean running;
    private RunStatus runStatus = RunStatus.IDLE;
    private String haltReason;
    private Long startedAt;
    private Long finishedAt;

    public ProductionState() {
    }

    public ProductionState(QualityTier qualityTier) {
        this.qualityTier = qualityTier;
        this.auditApproved = true;
    }

    void attachShots(List<Shot> shots) {
        this.shots = shots;
    }

    @JsonIgnore
    public List<Shot> getShots() {
        return shots;
    }

    public Optional<Shot> findShot(String shotId) {
        return shots.stream().filter(s -> s.getId().equals(shotId)).findFirst();
    }

    @JsonIgnore
    public Optional<Shot> generatingShot() {
        return shots.stream().filter(s -> s.getStatus() == ShotStatus.GENERATING).findFirst();
    }

    @JsonIgnore
    public boolean isAllCompleted() {
        return !shots.isEmpty() && shots.stream().allMatch(s -> s.getStatus() == ShotStatus.COMPLETED);
    }

    public VoiceTrack voiceTrackFor(String shotId) {
        return voiceTracks.stream()
                .filter(v -> v.getShotId().equals(shotId))
                .findFirst()
                .orElseGet(() -> {
                    VoiceTrack track = new VoiceTrack(shotId);
                    voiceTracks.add(track);
                    return track;
                });
    }

    public int getCurrentShotIndex() {
        return currentShotIndex;
    }

    public void setCurrentShotIndex(int currentShotIndex) {
        this.currentShotIndex = currentShotIndex;
    }

    public MasterAnchor getMasterAnchor() {
        return masterAnchor;
    }

    public void setMasterAnchor(MasterAnchor masterAnchor) {
        this.masterAnchor = masterAnchor;
    }

    public ChainContext getChainContext() {
        return chainContext;
    }

    public void setChainContext(ChainContext chainContext) {
        this.chainContext = chainContext;
    }

    public List<VoiceTrack> getVoiceTracks() {
        return voiceTracks;
    }

    public void setVoiceTracks(List<VoiceTrack> voiceTracks) {
        this.voiceTracks = voiceTracks == null ? new ArrayList<>() : new ArrayList<>(voiceTracks);
    }

    public QualityTier getQualityTier() {
        return qualityTier;
    }

    public void setQualityTier(QualityTier qualityTier) {
        this.qualityTier = qualityTier;
    }

    public boolean isAuditApproved() {
        return auditApproved;
    }

    public void setAuditApproved(boolean auditApproved) {
        this.auditApproved = auditApproved;
    }

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    public RunStatus getRunStatus() {
        return runStatus;
    }

    public void setRunStatus(RunStatus runStatus) {
        this.runStatus = runStatus;
    }

    public String getHaltReason() {
        return haltReason;
    }

    public void setHaltReason(String haltReason) {
        this.haltReason = haltReason;
    }

    public Long getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Long startedAt) {
        this.startedAt = startedAt;
    }

    public Long getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Long finishedAt) {
        this.finishedAt = finishedAt;
    }
}
