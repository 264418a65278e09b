package com.example.shotforge_backend.config;

import com.example.shotforge_backend.model.QualityTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credit cost of one generated shot per quality tier.
 */
@ConfigurationProperties(prefix = "billing")
public class BillingProperties {
    private TierCost tierCost = new TierCost();

    public TierCost getTierCost() {
        return tierCost;
    }

    public void setTierCost(TierCost tierCost) {
        this.tierCost = tierCost;
    }

    public long costFor(QualityTier tier) {
        return switch (tier) {
            case STANDARD -> tierCost.getStandard();
            case PROFESSIONAL -> tierCost.getProfessional();
        };
    }

    public static class TierCost {
        private long standard = 25;
        private long professional = 40;

        public long getStandard() {
            return standard;
        }

        public void setStandard(long standard) {
            this.standard = standard;
        }

        public long getProfessional() {
            return professional;
        }

        public void setProfessional(long professional) {
            this.professional = professional;
        }
    }
}
