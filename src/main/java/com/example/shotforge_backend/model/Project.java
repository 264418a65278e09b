package com.example.shotforge_backend.model;

import com.example.shotforge_backend.util.AudioMixMode;
import com.example.shotforge_backend.util.ProjectStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "project", indexes = @Index(name = "idx_project_status", columnList = "status"))
public class Project {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_project_owner"))
    private Account owner;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "genre", length = 128)
    private String genre;

    @Column(name = "synopsis", length = 20000)
    private String synopsis;

    @Column(name = "target_duration_seconds", nullable = false)
    private int targetDurationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ProjectStatus status = ProjectStatus.DRAFT;

    @Column(name = "generated_script", length = 200000)
    private String generatedScript;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_tier", nullable = false, length = 32)
    private QualityTier qualityTier = QualityTier.STANDARD;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "shots")
    private List<Shot> shots = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reference_anchor")
    private ReferenceAnchor referenceAnchor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "audit_result")
    private AuditResult auditResult;

    @Column(name = "audit_approved", nullable = false)
    private boolean auditApproved;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "production_state")
    private ProductionState productionState;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "clip_urls")
    private List<String> clipUrls = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "audio_mix_mode", nullable = false, length = 32)
    private AudioMixMode audioMixMode = AudioMixMode.FULL;

    @Column(name = "export_url", length = 2048)
    private String exportUrl;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Project() {
    }

    public Project(Account owner, String title, String genre, String synopsis, int targetDurationSeconds) {
        this.owner = owner;
        this.title = title;
        this.genre = genre;
        this.synopsis = synopsis;
        this.targetDurationSeconds = targetDurationSeconds;
    }

    public Optional<Shot> findShot(String shotId) {
        return shots.stream().filter(s -> s.getId().equals(shotId)).findFirst();
    }

    /**
     * Production has been started at least once; the master anchor and the audit are locked from then on.
     */
    public boolean isProductionStarted() {
        return productionState != null && productionState.getStartedAt() != null;
    }

    public boolean isAnalysisComplete() {
        return referenceAnchor != null && referenceAnchor.analysisComplete();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Account getOwner() {
        return owner;
    }

    public void setOwner(Account owner) {
        this.owner = owner;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getGenre() {
        return genre;
    }

    public void setGenre(String genre) {
        this.genre = genre;
    }

    public String getSynopsis() {
        return synopsis;
    }

    public void setSynopsis(String synopsis) {
        this.synopsis = synopsis;
    }

    public int getTargetDurationSeconds() {
        return targetDurationSeconds;
    }

    public void setTargetDurationSeconds(int targetDurationSeconds) {
        this.targetDurationSeconds = targetDurationSeconds;
    }

    public ProjectStatus getStatus() {
        return status;
    }

    public void setStatus(ProjectStatus status) {
        this.status = status;
    }

    public String getGeneratedScript() {
        return generatedScript;
    }

    public void setGeneratedScript(String generatedScript) {
        this.generatedScript = generatedScript;
    }

    public QualityTier getQualityTier() {
        return qualityTier;
    }

    public void setQualityTier(QualityTier qualityTier) {
        this.qualityTier = qualityTier;
    }

    public List<Shot> getShots() {
        return shots;
    }

    public void setShots(List<Shot> shots) {
        this.shots = shots == null ? new ArrayList<>() : new ArrayList<>(shots);
    }

    public ReferenceAnchor getReferenceAnchor() {
        return referenceAnchor;
    }

    public void setReferenceAnchor(ReferenceAnchor referenceAnchor) {
        this.referenceAnchor = referenceAnchor;
    }

    public AuditResult getAuditResult() {
        return auditResult;
    }

    public void setAuditResult(AuditResult auditResult) {
        this.auditResult = auditResult;
    }

    public boolean isAuditApproved() {
        return auditApproved;
    }

    public void setAuditApproved(boolean auditApproved) {
        this.auditApproved = auditApproved;
    }

    /**
     * Production state with the project's shot list attached, or {@code null} before approval.
     */
    public ProductionState getProductionState() {
        if (productionState != null) {
            productionState.attachShots(shots);
        }
        return productionState;
    }

    public void setProductionState(ProductionState productionState) {
        this.productionState = productionState;
    }

    public List<String> getClipUrls() {
        return clipUrls;
    }

    public void setClipUrls(List<String> clipUrls) {
        this.clipUrls = clipUrls == null ? new ArrayList<>() : new ArrayList<>(clipUrls);
    }

    public AudioMixMode getAudioMixMode() {
        return audioMixMode;
    }

    public void setAudioMixMode(AudioMixMode audioMixMode) {
        this.audioMixMode = audioMixMode;
    }

    public String getExportUrl() {
        return exportUrl;
    }

    public void setExportUrl(String exportUrl) {
        this.exportUrl = exportUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
