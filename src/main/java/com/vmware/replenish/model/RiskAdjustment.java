/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * Risk-adjusted parameters for one product, location and period. Multipliers scale the
 * product lead time and the forecast demand variance; a shock marks a disruption whose
 * extra effect is configured on the optimizer.
 */
public record RiskAdjustment(String productId, String locationId, int period, double leadTimeMultiplier,
                             double demandVarianceMultiplier, boolean shock) {

    public static RiskAdjustment identity(final PeriodKey key) {
        return new RiskAdjustment(key.productId(), key.locationId(), key.period(), 1.0, 1.0, false);
    }

    public PeriodKey key() {
        return new PeriodKey(productId, locationId, period);
    }

    public boolean isIdentity() {
        return leadTimeMultiplier == 1.0 && demandVarianceMultiplier == 1.0 && !shock;
    }

    /**
     * Compose two adjustments for the same key: multipliers multiply, shocks are or-ed.
     */
    public RiskAdjustment combine(final RiskAdjustment other) {
        assert key().equals(other.key());
        return new RiskAdjustment(productId, locationId, period,
                leadTimeMultiplier * other.leadTimeMultiplier,
                demandVarianceMultiplier * other.demandVarianceMultiplier,
                shock || other.shock);
    }
}
