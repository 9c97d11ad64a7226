/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * How the policy of a partition was obtained.
 */
public enum Resolution {
    /** Nominal model solved. */
    SOLVED,
    /** Solved after allowing backlog beyond the nominal shortage bound. */
    RELAXED_BACKLOG,
    /** Solved after allowing backlog and lowering the safety-stock target. */
    REDUCED_SAFETY_STOCK,
    /** Reorder-point heuristic, no solver involved. */
    HEURISTIC,
    /** Reused from the last good cycle after a timeout. */
    PRIOR_CYCLE,
    /** No usable policy; placeholder record. */
    FAILED;

    public boolean isRelaxed() {
        return this == RELAXED_BACKLOG || this == REDUCED_SAFETY_STOCK || this == HEURISTIC;
    }
}
