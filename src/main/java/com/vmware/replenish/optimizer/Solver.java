/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * Solves an {@link OptimizationProblem} within a time budget. Implementations never throw
 * for backend trouble; every outcome is reported through the status of the returned solution.
 */
public interface Solver {

    /**
     * @param problem         the model to solve, not modified
     * @param timeLimitMillis wall clock budget
     * @param gapTolerance    relative MIP gap accepted as optimal enough
     * @return a solution that always carries a status
     */
    Solution solve(OptimizationProblem problem, long timeLimitMillis, double gapTolerance);

    /**
     * @return a short name for logs and audit records
     */
    String name();
}
