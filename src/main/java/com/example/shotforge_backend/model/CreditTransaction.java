package com.example.shotforge_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One committed shot charge. The unique key on (project, shot) makes a second commit for the same
 * shot impossible.
 */
@Entity
@Table(name = "credit_transaction",
        uniqueConstraints = @UniqueConstraint(name = "ux_credit_tx_project_shot", columnNames = {"project_id", "shot_id"}))
public class CreditTransaction {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "shot_id", nullable = false, length = 16)
    private String shotId;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_tier", nullable = false, length = 32)
    private QualityTier qualityTier;

    @Column(name = "amount", nullable = false)
    private long amount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CreditTransaction() {
    }

    public CreditTransaction(UUID accountId, UUID projectId, String shotId, QualityTier qualityTier, long amount) {
        this.accountId = accountId;
        this.projectId = projectId;
        this.shotId = shotId;
        this.qualityTier = qualityTier;
        this.amount = amount;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getShotId() {
        return shotId;
    }

    public QualityTier getQualityTier() {
        return qualityTier;
    }

    public long getAmount() {
        return amount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
