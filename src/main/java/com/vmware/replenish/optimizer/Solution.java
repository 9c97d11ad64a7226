/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import com.vmware.replenish.model.SolverStatus;

/**
 * Outcome of one solve. Variable values are only available for accepted statuses.
 */
public final class Solution {
    private final SolverStatus status;
    private final double objectiveValue;
    private final double bestBound;
    private final double gap;
    private final long wallTimeMillis;
    private final String message;
    private final double[] values;

    private Solution(final SolverStatus status, final double objectiveValue, final double bestBound,
                     final double gap, final long wallTimeMillis, final String message, final double[] values) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.bestBound = bestBound;
        this.gap = gap;
        this.wallTimeMillis = wallTimeMillis;
        this.message = message;
        this.values = values;
    }

    public static Solution accepted(final SolverStatus status, final double objectiveValue, final double bestBound,
                                    final double gap, final long wallTimeMillis, final double[] values) {
        assert status.isAccepted();
        return new Solution(status, objectiveValue, bestBound, gap, wallTimeMillis, status.name(), values.clone());
    }

    public static Solution rejected(final SolverStatus status, final String message, final long wallTimeMillis) {
        assert !status.isAccepted();
        return new Solution(status, Double.NaN, Double.NaN, Double.NaN, wallTimeMillis, message, null);
    }

    public SolverStatus status() {
        return status;
    }

    public boolean isAccepted() {
        return status.isAccepted();
    }

    public double objectiveValue() {
        return objectiveValue;
    }

    public double bestBound() {
        return bestBound;
    }

    public double gap() {
        return gap;
    }

    public long wallTimeMillis() {
        return wallTimeMillis;
    }

    public String message() {
        return message;
    }

    public double value(final Variable variable) {
        if (values == null) {
            throw new IllegalStateException("No values for a solution with status " + status);
        }
        return values[variable.index()];
    }

    /**
     * @return a copy of all variable values, indexed like the problem's variables
     */
    public double[] values() {
        if (values == null) {
            throw new IllegalStateException("No values for a solution with status " + status);
        }
        return values.clone();
    }

    @Override
    public String toString() {
        return String.format("Solution{status=%s, objective=%s, bound=%s, gap=%s, wallTimeMillis=%d, message=%s}",
                status, objectiveValue, bestBound, gap, wallTimeMillis, message);
    }
}
