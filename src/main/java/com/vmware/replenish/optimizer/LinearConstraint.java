/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * {@code lowerBound <= expression <= upperBound}. Infinite bounds are open sides.
 */
public record LinearConstraint(String name, double lowerBound, double upperBound, LinearExpression expression) {

    public boolean isSatisfied(final double[] values, final double tolerance) {
        final double activity = expression.evaluate(values);
        return activity >= lowerBound - tolerance && activity <= upperBound + tolerance;
    }
}
