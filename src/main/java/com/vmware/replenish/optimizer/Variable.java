/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * A decision variable of an {@link OptimizationProblem}. The index is the position of the
 * variable in the problem and in every solution of that problem.
 */
public record Variable(int index, String name, double lowerBound, double upperBound, boolean integer) {
}
