/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A group of products and locations solved together. The items of a partition are the
 * product x location pairs that have at least one forecast in the horizon.
 */
public record Partition(String partitionId, List<String> productIds, List<String> locationIds) {

    public Partition {
        productIds = List.copyOf(productIds);
        locationIds = List.copyOf(locationIds);
    }

    /**
     * Items of this partition in deterministic order: locations first, then products, both
     * in the order given.
     */
    public List<ItemKey> items(final PlanningSnapshot snapshot, final Horizon horizon) {
        final List<ItemKey> items = new ArrayList<>();
        for (final String locationId : locationIds) {
            for (final String productId : productIds) {
                final ItemKey item = new ItemKey(productId, locationId);
                if (snapshot.hasForecasts(item, horizon)) {
                    items.add(item);
                }
            }
        }
        return items;
    }
}
