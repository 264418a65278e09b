package com.example.shotforge_backend.engine.Interfaces;

import com.example.shotforge_backend.model.QualityTier;

import java.util.UUID;

/**
 * External source of truth for credit balances. Consulted by the billing guard, never owned by it.
 */
public interface CreditLedger {
    long balance(UUID accountId);

    /**
     * Debits {@code amount} for one shot. Must be idempotent per {@code (projectId, shotId)}.
     *
     * @return {@code true} when the shot is charged (now or previously), {@code false} when the
     *         balance does not cover the amount.
     */
    boolean debit(UUID accountId, UUID projectId, String shotId, QualityTier tier, long amount);

    boolean isCharged(UUID projectId, String shotId);
}
