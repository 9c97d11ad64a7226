/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * A stocking location.
 *
 * @param locationId         the location identifier
 * @param capacity           storage bound shared by every product held at the location
 * @param serviceLevelTarget probability of not stocking out during the lead time, in (0, 1)
 */
public record Location(String locationId, double capacity, double serviceLevelTarget) {
}
