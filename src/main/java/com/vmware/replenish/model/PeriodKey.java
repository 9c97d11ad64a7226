/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * A (product, location, period) triple.
 */
public record PeriodKey(String productId, String locationId, int period) {

    public ItemKey item() {
        return new ItemKey(productId, locationId);
    }
}
