/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Resolution;
import com.vmware.replenish.model.SolverStatus;
import com.vmware.replenish.optimizer.PolicyExtractor.ExtractionResult;

/**
 * What happened to one partition in a cycle. Filled in by the worker that ran the partition,
 * then finalized by the controller when the policies are persisted.
 */
public final class PartitionOutcome {
    private final String partitionId;
    private final List<PartitionState> history = new ArrayList<>();
    private SolverStatus nominalStatus = null;
    private Resolution resolution = null;
    private List<Policy> policies = List.of();
    private ExtractionResult audit = null;
    private String error = null;
    private boolean resolveRequested = false;
    private long wallTimeMillis = 0;

    PartitionOutcome(final String partitionId) {
        this.partitionId = partitionId;
    }

    void enter(final PartitionState state) {
        assert history.isEmpty() || !state().isTerminal();
        history.add(state);
    }

    void setNominalStatus(final SolverStatus nominalStatus) {
        this.nominalStatus = nominalStatus;
    }

    void setResult(final Resolution resolution, final List<Policy> policies, final ExtractionResult audit) {
        this.resolution = resolution;
        this.policies = List.copyOf(policies);
        this.audit = audit;
    }

    void setError(final String error) {
        this.error = error;
    }

    void setResolveRequested(final boolean resolveRequested) {
        this.resolveRequested = resolveRequested;
    }

    void setWallTimeMillis(final long wallTimeMillis) {
        this.wallTimeMillis = wallTimeMillis;
    }

    public String partitionId() {
        return partitionId;
    }

    /**
     * @return the current stage, or null before the pipeline started
     */
    public PartitionState state() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public List<PartitionState> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * @return status of the solve with nominal constraints, null if the partition never reached the solver
     */
    public SolverStatus nominalStatus() {
        return nominalStatus;
    }

    public Resolution resolution() {
        return resolution;
    }

    public boolean isFailed() {
        return resolution == Resolution.FAILED;
    }

    public List<Policy> policies() {
        return policies;
    }

    /**
     * @return realized costs of the persisted plan, null when it did not come from an extracted solution
     */
    public ExtractionResult audit() {
        return audit;
    }

    public String error() {
        return error;
    }

    public boolean resolveRequested() {
        return resolveRequested;
    }

    public long wallTimeMillis() {
        return wallTimeMillis;
    }

    @Override
    public String toString() {
        return String.format("PartitionOutcome{partition=%s, state=%s, nominalStatus=%s, resolution=%s, "
                + "policies=%d, resolveRequested=%s, error=%s}", partitionId, state(), nominalStatus, resolution,
                policies.size(), resolveRequested, error);
    }
}
