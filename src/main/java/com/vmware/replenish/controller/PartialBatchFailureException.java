/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import com.vmware.replenish.optimizer.ReplenishmentException;

/**
 * Raised after a cycle has been persisted when more partitions failed than the configured
 * threshold allows.
 */
public class PartialBatchFailureException extends ReplenishmentException {
    private static final long serialVersionUID = 1L;

    private final transient BatchReport report;

    public PartialBatchFailureException(final BatchReport report) {
        super(String.format("Cycle %s: %d of %d partitions failed", report.cycleId(), report.failedCount(),
                report.outcomes().size()));
        this.report = report;
    }

    public BatchReport report() {
        return report;
    }
}
