package com.example.shotforge_backend.model;

/**
 * Billing/quality level of a production; decides the per-shot credit cost.
 */
public enum QualityTier {
    STANDARD,
    PROFESSIONAL
}
