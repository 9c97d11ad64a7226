/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

/**
 * Pipeline stage of a partition within a cycle.
 */
public enum PartitionState {
    BUILDING,
    SOLVING,
    EXTRACTING,
    REPAIRING,
    PERSISTED,
    FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }
}
