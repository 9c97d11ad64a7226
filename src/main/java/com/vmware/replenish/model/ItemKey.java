/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * A (product, location) pair.
 */
public record ItemKey(String productId, String locationId) {

    public PeriodKey at(final int period) {
        return new PeriodKey(productId, locationId, period);
    }

    @Override
    public String toString() {
        return productId + "@" + locationId;
    }
}
