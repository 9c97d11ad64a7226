/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * The replenishment decision for one product, location and period.
 *
 * @param solverStatus   status of the nominal solve of the partition this record belongs to
 * @param objectiveValue this record's contribution to the objective of the solve that produced it
 * @param resolution     how the record was obtained
 */
public record Policy(String productId, String locationId, int period, double orderQuantity,
                     double safetyStock, double reorderPoint, SolverStatus solverStatus,
                     double objectiveValue, Resolution resolution) {

    /**
     * A zero placeholder for an item period whose partition produced no usable policy.
     */
    public static Policy failed(final PeriodKey key, final SolverStatus status) {
        return new Policy(key.productId(), key.locationId(), key.period(), 0.0, 0.0, 0.0, status, 0.0,
                Resolution.FAILED);
    }

    public PeriodKey key() {
        return new PeriodKey(productId, locationId, period);
    }

    public ItemKey item() {
        return new ItemKey(productId, locationId);
    }

    public Policy withOutcome(final SolverStatus status, final Resolution newResolution) {
        return new Policy(productId, locationId, period, orderQuantity, safetyStock, reorderPoint, status,
                objectiveValue, newResolution);
    }
}
