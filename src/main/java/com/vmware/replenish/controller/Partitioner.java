/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;

/**
 * Splits a snapshot into solve units. A location is never split across partitions since
 * its capacity couples every product stocked there.
 */
public final class Partitioner {

    private Partitioner() {
        // Private constructor
    }

    /**
     * Group whole locations, in id order, into partitions of at most maxItems planned
     * (product, location) pairs. A location with more items than that gets a partition of its own.
     *
     * @param snapshot the cycle data
     * @param horizon  the planning window, only items with forecasts inside it count
     * @param maxItems the item budget of a partition
     * @return partitions with ids partition-1, partition-2, ...
     */
    public static List<Partition> byLocation(final PlanningSnapshot snapshot, final Horizon horizon,
                                             final int maxItems) {
        assert maxItems > 0;
        final List<Partition> partitions = new ArrayList<>();
        List<String> locationIds = new ArrayList<>();
        TreeSet<String> productIds = new TreeSet<>();
        int items = 0;
        for (final Location location : snapshot.locations()) {
            final TreeSet<String> stocked = productsAt(snapshot, horizon, location.locationId());
            if (stocked.isEmpty()) {
                continue;
            }
            if (!locationIds.isEmpty() && items + stocked.size() > maxItems) {
                partitions.add(new Partition("partition-" + (partitions.size() + 1),
                        new ArrayList<>(productIds), locationIds));
                locationIds = new ArrayList<>();
                productIds = new TreeSet<>();
                items = 0;
            }
            locationIds.add(location.locationId());
            productIds.addAll(stocked);
            items += stocked.size();
        }
        if (!locationIds.isEmpty()) {
            partitions.add(new Partition("partition-" + (partitions.size() + 1),
                    new ArrayList<>(productIds), locationIds));
        }
        return partitions;
    }

    private static TreeSet<String> productsAt(final PlanningSnapshot snapshot, final Horizon horizon,
                                              final String locationId) {
        final TreeSet<String> products = new TreeSet<>();
        for (final DemandForecast forecast : snapshot.forecasts()) {
            if (forecast.locationId().equals(locationId) && horizon.contains(forecast.period())) {
                products.add(forecast.productId());
            }
        }
        return products;
    }
}
