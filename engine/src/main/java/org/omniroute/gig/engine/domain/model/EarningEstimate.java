package org.omniroute.gig.engine.domain.model;

import java.math.BigDecimal;

/**
 * Earning breakdown returned by the pricing collaborator.
 */
public final class EarningEstimate {

    private final BigDecimal baseEarning;
    private final BigDecimal distanceEarning;
    private final BigDecimal weightEarning;
    private final BigDecimal timeEarning;
    private final BigDecimal surgeMultiplier;
    private final BigDecimal bonusEarning;
    private final BigDecimal totalEarning;

    private EarningEstimate(Builder builder) {
        this.baseEarning = orZero(builder.baseEarning);
        this.distanceEarning = orZero(builder.distanceEarning);
        this.weightEarning = orZero(builder.weightEarning);
        this.timeEarning = orZero(builder.timeEarning);
        this.surgeMultiplier = builder.surgeMultiplier != null ? builder.surgeMultiplier : BigDecimal.ONE;
        this.bonusEarning = orZero(builder.bonusEarning);
        this.totalEarning = orZero(builder.totalEarning);
    }

    public BigDecimal getBaseEarning() {
        return baseEarning;
    }

    public BigDecimal getDistanceEarning() {
        return distanceEarning;
    }

    public BigDecimal getWeightEarning() {
        return weightEarning;
    }

    public BigDecimal getTimeEarning() {
        return timeEarning;
    }

    public BigDecimal getSurgeMultiplier() {
        return surgeMultiplier;
    }

    public BigDecimal getBonusEarning() {
        return bonusEarning;
    }

    public BigDecimal getTotalEarning() {
        return totalEarning;
    }

    @Override
    public String toString() {
        return "EarningEstimate{base=" + baseEarning + ", bonus=" + bonusEarning + ", total=" + totalEarning + '}';
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EarningEstimate.
     */
    public static final class Builder {
        private BigDecimal baseEarning;
        private BigDecimal distanceEarning;
        private BigDecimal weightEarning;
        private BigDecimal timeEarning;
        private BigDecimal surgeMultiplier;
        private BigDecimal bonusEarning;
        private BigDecimal totalEarning;

        public Builder baseEarning(BigDecimal baseEarning) {
            this.baseEarning = baseEarning;
            return this;
        }

        public Builder distanceEarning(BigDecimal distanceEarning) {
            this.distanceEarning = distanceEarning;
            return this;
        }

        public Builder weightEarning(BigDecimal weightEarning) {
            this.weightEarning = weightEarning;
            return this;
        }

        public Builder timeEarning(BigDecimal timeEarning) {
            this.timeEarning = timeEarning;
            return this;
        }

        public Builder surgeMultiplier(BigDecimal surgeMultiplier) {
            this.surgeMultiplier = surgeMultiplier;
            return this;
        }

        public Builder bonusEarning(BigDecimal bonusEarning) {
            this.bonusEarning = bonusEarning;
            return this;
        }

        public Builder totalEarning(BigDecimal totalEarning) {
            this.totalEarning = totalEarning;
            return this;
        }

        public EarningEstimate build() {
            return new EarningEstimate(this);
        }
    }
}
