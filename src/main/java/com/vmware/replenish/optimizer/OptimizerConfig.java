/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * Immutable settings shared by the builder, solver adapter, extractor and controller.
 * Create with {@link Builder}; every setting has a default.
 */
public final class OptimizerConfig {

    /**
     * How the safety-stock target is derived from the forecast dispersion.
     */
    public enum SafetyStockMethod {
        /** z(service level) times the lead-time standard deviation. */
        NORMAL_APPROXIMATION,
        /** Excess of the service-level quantile over the mean, from forecast quantiles. */
        EMPIRICAL_QUANTILE
    }

    /**
     * Secondary objective used among equal-cost optima.
     */
    public enum TieBreak {
        ORDER_COUNT,
        NONE
    }

    private final long timeLimitMillis;
    private final double gapTolerance;
    private final String backend;
    private final int randomSeed;
    private final double orderGranularity;
    private final int decimalPrecision;
    private final boolean integerOrders;
    private final SafetyStockMethod safetyStockMethod;
    private final TieBreak tieBreak;
    private final double tieBreakTimeShare;
    private final double shockLeadTimeFactor;
    private final double shockVarianceFactor;
    private final double repairSafetyStockScale;
    private final int workers;
    private final double partialFailureThreshold;
    private final double resolveTimeLimitMultiplier;

    private OptimizerConfig(final Builder builder) {
        this.timeLimitMillis = builder.timeLimitMillis;
        this.gapTolerance = builder.gapTolerance;
        this.backend = builder.backend;
        this.randomSeed = builder.randomSeed;
        this.orderGranularity = builder.orderGranularity;
        this.decimalPrecision = builder.decimalPrecision;
        this.integerOrders = builder.integerOrders;
        this.safetyStockMethod = builder.safetyStockMethod;
        this.tieBreak = builder.tieBreak;
        this.tieBreakTimeShare = builder.tieBreakTimeShare;
        this.shockLeadTimeFactor = builder.shockLeadTimeFactor;
        this.shockVarianceFactor = builder.shockVarianceFactor;
        this.repairSafetyStockScale = builder.repairSafetyStockScale;
        this.workers = builder.workers;
        this.partialFailureThreshold = builder.partialFailureThreshold;
        this.resolveTimeLimitMultiplier = builder.resolveTimeLimitMultiplier;
    }

    public static OptimizerConfig defaults() {
        return new Builder().build();
    }

    public long timeLimitMillis() {
        return timeLimitMillis;
    }

    public double gapTolerance() {
        return gapTolerance;
    }

    /**
     * @return the OR-tools linear solver id, e.g. SCIP or CBC
     */
    public String backend() {
        return backend;
    }

    public int randomSeed() {
        return randomSeed;
    }

    public double orderGranularity() {
        return orderGranularity;
    }

    /**
     * @return decimal places kept for safety stock, reorder points and costs
     */
    public int decimalPrecision() {
        return decimalPrecision;
    }

    public boolean integerOrders() {
        return integerOrders;
    }

    public SafetyStockMethod safetyStockMethod() {
        return safetyStockMethod;
    }

    public TieBreak tieBreak() {
        return tieBreak;
    }

    /**
     * @return the fixed share of a solve's time limit reserved for the secondary objective
     */
    public double tieBreakTimeShare() {
        return tieBreakTimeShare;
    }

    public double shockLeadTimeFactor() {
        return shockLeadTimeFactor;
    }

    public double shockVarianceFactor() {
        return shockVarianceFactor;
    }

    public double repairSafetyStockScale() {
        return repairSafetyStockScale;
    }

    public int workers() {
        return workers;
    }

    public double partialFailureThreshold() {
        return partialFailureThreshold;
    }

    public double resolveTimeLimitMultiplier() {
        return resolveTimeLimitMultiplier;
    }

    @Override
    public String toString() {
        return String.format("OptimizerConfig{backend=%s, timeLimitMillis=%d, gap=%s, seed=%d, granularity=%s, "
                + "precision=%d, integerOrders=%s, safetyStock=%s, tieBreak=%s, tieBreakShare=%s, workers=%d, "
                + "failureThreshold=%s}",
                backend, timeLimitMillis, gapTolerance, randomSeed, orderGranularity, decimalPrecision,
                integerOrders, safetyStockMethod, tieBreak, tieBreakTimeShare, workers, partialFailureThreshold);
    }

    public static final class Builder {
        private long timeLimitMillis = 10_000;
        private double gapTolerance = 1e-4;
        private String backend = "SCIP";
        private int randomSeed = 0;
        private double orderGranularity = 1.0;
        private int decimalPrecision = 6;
        private boolean integerOrders = false;
        private SafetyStockMethod safetyStockMethod = SafetyStockMethod.NORMAL_APPROXIMATION;
        private TieBreak tieBreak = TieBreak.ORDER_COUNT;
        private double tieBreakTimeShare = 0.2;
        private double shockLeadTimeFactor = 1.5;
        private double shockVarianceFactor = 2.0;
        private double repairSafetyStockScale = 0.5;
        private int workers = Runtime.getRuntime().availableProcessors();
        private double partialFailureThreshold = 0.2;
        private double resolveTimeLimitMultiplier = 2.0;

        public Builder setTimeLimitMillis(final long timeLimitMillis) {
            this.timeLimitMillis = timeLimitMillis;
            return this;
        }

        public Builder setGapTolerance(final double gapTolerance) {
            this.gapTolerance = gapTolerance;
            return this;
        }

        public Builder setBackend(final String backend) {
            this.backend = backend;
            return this;
        }

        public Builder setRandomSeed(final int randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder setOrderGranularity(final double orderGranularity) {
            this.orderGranularity = orderGranularity;
            return this;
        }

        public Builder setDecimalPrecision(final int decimalPrecision) {
            this.decimalPrecision = decimalPrecision;
            return this;
        }

        public Builder setIntegerOrders(final boolean integerOrders) {
            this.integerOrders = integerOrders;
            return this;
        }

        public Builder setSafetyStockMethod(final SafetyStockMethod safetyStockMethod) {
            this.safetyStockMethod = safetyStockMethod;
            return this;
        }

        public Builder setTieBreak(final TieBreak tieBreak) {
            this.tieBreak = tieBreak;
            return this;
        }

        public Builder setTieBreakTimeShare(final double tieBreakTimeShare) {
            this.tieBreakTimeShare = tieBreakTimeShare;
            return this;
        }

        public Builder setShockLeadTimeFactor(final double shockLeadTimeFactor) {
            this.shockLeadTimeFactor = shockLeadTimeFactor;
            return this;
        }

        public Builder setShockVarianceFactor(final double shockVarianceFactor) {
            this.shockVarianceFactor = shockVarianceFactor;
            return this;
        }

        public Builder setRepairSafetyStockScale(final double repairSafetyStockScale) {
            this.repairSafetyStockScale = repairSafetyStockScale;
            return this;
        }

        public Builder setWorkers(final int workers) {
            this.workers = workers;
            return this;
        }

        public Builder setPartialFailureThreshold(final double partialFailureThreshold) {
            this.partialFailureThreshold = partialFailureThreshold;
            return this;
        }

        public Builder setResolveTimeLimitMultiplier(final double resolveTimeLimitMultiplier) {
            this.resolveTimeLimitMultiplier = resolveTimeLimitMultiplier;
            return this;
        }

        public OptimizerConfig build() {
            if (timeLimitMillis <= 0) {
                throw new IllegalArgumentException("timeLimitMillis must be > 0");
            }
            if (gapTolerance < 0) {
                throw new IllegalArgumentException("gapTolerance must be >= 0");
            }
            if (!(orderGranularity > 0)) {
                throw new IllegalArgumentException("orderGranularity must be > 0");
            }
            if (decimalPrecision < 0) {
                throw new IllegalArgumentException("decimalPrecision must be >= 0");
            }
            if (workers <= 0) {
                throw new IllegalArgumentException("workers must be > 0");
            }
            if (repairSafetyStockScale < 0 || repairSafetyStockScale > 1) {
                throw new IllegalArgumentException("repairSafetyStockScale must be in [0, 1]");
            }
            if (partialFailureThreshold < 0 || partialFailureThreshold > 1) {
                throw new IllegalArgumentException("partialFailureThreshold must be in [0, 1]");
            }
            if (tieBreakTimeShare < 0 || tieBreakTimeShare >= 1) {
                throw new IllegalArgumentException("tieBreakTimeShare must be in [0, 1)");
            }
            if (resolveTimeLimitMultiplier < 1) {
                throw new IllegalArgumentException("resolveTimeLimitMultiplier must be >= 1");
            }
            return new OptimizerConfig(this);
        }
    }
}
