/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * Soft-constraint settings of a model build.
 *
 * @param unboundedBacklog  if true shortage may reach the full demand of a period, otherwise it is
 *                          capped at the nominal (1 - service level) share
 * @param safetyStockScale  multiplier on the safety-stock target, 1 for the nominal model
 */
public record Relaxation(boolean unboundedBacklog, double safetyStockScale) {
    public static final Relaxation NOMINAL = new Relaxation(false, 1.0);

    public static Relaxation backlog() {
        return new Relaxation(true, 1.0);
    }

    public static Relaxation backlogWithSafetyStock(final double scale) {
        return new Relaxation(true, scale);
    }
}
