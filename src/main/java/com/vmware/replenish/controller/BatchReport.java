/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Resolution;

/**
 * Result of a cycle: one outcome per partition, in partition order.
 */
public record BatchReport(String cycleId, List<PartitionOutcome> outcomes, long wallTimeMillis) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public int failedCount() {
        int failed = 0;
        for (final PartitionOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failed++;
            }
        }
        return failed;
    }

    public double failedFraction() {
        return outcomes.isEmpty() ? 0.0 : (double) failedCount() / outcomes.size();
    }

    /**
     * @return all policies of the cycle, partition by partition
     */
    public List<Policy> policies() {
        final List<Policy> policies = new ArrayList<>();
        for (final PartitionOutcome outcome : outcomes) {
            policies.addAll(outcome.policies());
        }
        return policies;
    }

    public Map<Resolution, Integer> resolutionCounts() {
        final Map<Resolution, Integer> counts = new EnumMap<>(Resolution.class);
        for (final PartitionOutcome outcome : outcomes) {
            if (outcome.resolution() != null) {
                counts.merge(outcome.resolution(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public PartitionOutcome outcome(final String partitionId) {
        for (final PartitionOutcome outcome : outcomes) {
            if (outcome.partitionId().equals(partitionId)) {
                return outcome;
            }
        }
        return null;
    }
}
