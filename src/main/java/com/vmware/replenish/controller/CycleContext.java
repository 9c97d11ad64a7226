/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.util.List;

import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;

/**
 * Everything one planning cycle reads. Passed explicitly to the controller; nothing of it
 * outlives the cycle.
 *
 * @param cycleId    identifier of the cycle, used as the key of persisted policies
 * @param horizon    the planning window of the cycle
 * @param snapshot   read-only input data
 * @param partitions solve units, reported back in this order
 */
public record CycleContext(String cycleId, Horizon horizon, PlanningSnapshot snapshot, List<Partition> partitions) {

    public CycleContext {
        partitions = List.copyOf(partitions);
    }
}
