/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Starting conditions of an item: units on hand and receipts already in transit, keyed by
 * the period in which they arrive.
 */
public record InventoryPosition(String productId, String locationId, double onHand,
                                Map<Integer, Double> scheduledReceipts) {

    public InventoryPosition {
        scheduledReceipts = scheduledReceipts == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(scheduledReceipts));
    }

    public static InventoryPosition empty(final ItemKey item) {
        return new InventoryPosition(item.productId(), item.locationId(), 0.0, null);
    }

    public ItemKey item() {
        return new ItemKey(productId, locationId);
    }

    public double receiptsAt(final int period) {
        return scheduledReceipts.getOrDefault(period, 0.0);
    }
}
