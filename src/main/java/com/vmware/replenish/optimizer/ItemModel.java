/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Product;

/**
 * Derived parameters and decision variables of one (product, location) pair. All arrays are
 * indexed by the zero based offset into the horizon.
 */
public final class ItemModel {
    private final Product product;
    private final Location location;
    private final double[] demand;
    private final double[] leadTimeDemand;
    private final double[] safetyStockTarget;
    private final double[] shortageBound;
    private final int[] leadTime;
    private final double onHand;
    private final double[] receipts;
    private final List<List<Integer>> arrivals;

    private Variable[] orderQty;
    private Variable[] orderPlaced;
    private Variable[] inventory;
    private Variable[] shortage;
    private Variable[] safetyStock;
    private Variable[] reorderPoint;

    /**
     * @param demand            forecast mean per period
     * @param leadTimeDemand    mean demand over the protection window starting at each period
     * @param safetyStockTarget safety-stock lower bound per period, relaxation scale applied
     * @param shortageBound     upper bound on shortage per period
     * @param leadTime          effective lead time of an order placed in each period
     * @param onHand            units on hand before the first period
     * @param receipts          units already in transit arriving in each period
     */
    ItemModel(final Product product, final Location location, final double[] demand,
              final double[] leadTimeDemand, final double[] safetyStockTarget, final double[] shortageBound,
              final int[] leadTime, final double onHand, final double[] receipts) {
        this.product = product;
        this.location = location;
        this.demand = demand;
        this.leadTimeDemand = leadTimeDemand;
        this.safetyStockTarget = safetyStockTarget;
        this.shortageBound = shortageBound;
        this.leadTime = leadTime;
        this.onHand = onHand;
        this.receipts = receipts;

        final int periods = demand.length;
        final List<List<Integer>> byArrival = new ArrayList<>(periods);
        for (int t = 0; t < periods; t++) {
            byArrival.add(new ArrayList<>());
        }
        for (int t = 0; t < periods; t++) {
            final int arrival = arrivalOf(t);
            if (arrival < periods) {
                byArrival.get(arrival).add(t);
            }
        }
        final List<List<Integer>> frozen = new ArrayList<>(periods);
        for (final List<Integer> orders : byArrival) {
            frozen.add(Collections.unmodifiableList(orders));
        }
        this.arrivals = Collections.unmodifiableList(frozen);
    }

    void attach(final Variable[] orderQty, final Variable[] orderPlaced, final Variable[] inventory,
                final Variable[] shortage, final Variable[] safetyStock, final Variable[] reorderPoint) {
        this.orderQty = orderQty;
        this.orderPlaced = orderPlaced;
        this.inventory = inventory;
        this.shortage = shortage;
        this.safetyStock = safetyStock;
        this.reorderPoint = reorderPoint;
    }

    public ItemKey key() {
        return new ItemKey(product.productId(), location.locationId());
    }

    public Product product() {
        return product;
    }

    public Location location() {
        return location;
    }

    public int periods() {
        return demand.length;
    }

    public double demand(final int t) {
        return demand[t];
    }

    public double leadTimeDemand(final int t) {
        return leadTimeDemand[t];
    }

    public double safetyStockTarget(final int t) {
        return safetyStockTarget[t];
    }

    public double shortageBound(final int t) {
        return shortageBound[t];
    }

    public int leadTime(final int t) {
        return leadTime[t];
    }

    public double onHand() {
        return onHand;
    }

    public double receipts(final int t) {
        return receipts[t];
    }

    /**
     * @return the horizon offset at which an order placed at offset t arrives
     */
    public int arrivalOf(final int t) {
        return t + leadTime[t];
    }

    public boolean canArrive(final int t) {
        return arrivalOf(t) < periods();
    }

    /**
     * @return offsets of the orders that arrive at offset t, ascending
     */
    public List<Integer> ordersArrivingAt(final int t) {
        return arrivals.get(t);
    }

    /**
     * @return the earliest offset any order placed inside the horizon can arrive, or the
     *         horizon length if none can
     */
    public int firstArrival() {
        int first = periods();
        for (int t = 0; t < periods(); t++) {
            first = Math.min(first, arrivalOf(t));
        }
        return first;
    }

    public Variable orderQty(final int t) {
        return orderQty[t];
    }

    public Variable orderPlaced(final int t) {
        return orderPlaced[t];
    }

    public Variable inventory(final int t) {
        return inventory[t];
    }

    public Variable shortage(final int t) {
        return shortage[t];
    }

    public Variable safetyStock(final int t) {
        return safetyStock[t];
    }

    public Variable reorderPoint(final int t) {
        return reorderPoint[t];
    }
}
