/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * Classification of a solve outcome. Every solve ends in exactly one of these.
 */
public enum SolverStatus {
    OPTIMAL,
    FEASIBLE_SUBOPTIMAL,
    INFEASIBLE,
    TIMED_OUT,
    ERROR;

    /**
     * @return true if the solution carries values that may be turned into policies
     */
    public boolean isAccepted() {
        return this == OPTIMAL || this == FEASIBLE_SUBOPTIMAL;
    }
}
