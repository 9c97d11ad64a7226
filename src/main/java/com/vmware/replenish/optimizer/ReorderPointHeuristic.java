/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.SolverStatus;

/**
 * Last resort planner that bypasses the MILP backend. Each period an item whose inventory
 * position falls below its reorder point orders up to it, respecting the MOQ; orders landing
 * at a location are then cut back until the stock on receipt fits the location capacity.
 * Unmet demand is lost. Meant to run on a backlog relaxed problem, whose shortage bounds
 * admit any lost sales.
 */
public class ReorderPointHeuristic implements Solver {
    protected Logger LOG = LogManager.getLogger(ReorderPointHeuristic.class);

    @Override
    public String name() {
        return "reorder-point-heuristic";
    }

    @Override
    public Solution solve(final OptimizationProblem problem, final long timeLimitMillis, final double gapTolerance) {
        final long start = System.nanoTime();
        final double[] values = new double[problem.numVariables()];

        for (final Location location : problem.locations()) {
            final List<ItemModel> items = problem.itemsAt(location.locationId());
            if (!planLocation(location, items, problem.horizon().length(), values)) {
                return Solution.rejected(SolverStatus.INFEASIBLE,
                        "Stock on receipt exceeds capacity of location " + location.locationId(), elapsed(start));
            }
        }

        final double objective = problem.primaryObjective().evaluate(values);
        LOG.debug("Heuristic plan for partition {}: objective={}", problem.partition().partitionId(), objective);
        return Solution.accepted(SolverStatus.FEASIBLE_SUBOPTIMAL, objective, Double.NaN, Double.NaN,
                elapsed(start), values);
    }

    /**
     * @return false if the location cannot hold its committed stock even without new orders
     */
    private boolean planLocation(final Location location, final List<ItemModel> items, final int periods,
                                 final double[] values) {
        if (location.capacity() < 0.0) {
            return false;
        }
        final int n = items.size();
        final double[][] orders = new double[n][periods];
        final double[] stock = new double[n];
        for (int i = 0; i < n; i++) {
            stock[i] = items.get(i).onHand();
        }

        for (int t = 0; t < periods; t++) {
            for (int i = 0; i < n; i++) {
                final ItemModel item = items.get(i);
                orders[i][t] = orderAt(item, t, stock[i], orders[i]);
            }

            double received = 0.0;
            double committed = 0.0;
            for (int i = 0; i < n; i++) {
                final ItemModel item = items.get(i);
                committed += stock[i] + item.receipts(t);
                received += stock[i] + item.receipts(t) + arriving(item, t, orders[i]);
            }
            if (committed > location.capacity() + 1e-9) {
                return false;
            }
            double excess = received - location.capacity();
            for (int i = n - 1; i >= 0 && excess > 1e-9; i--) {
                final ItemModel item = items.get(i);
                for (final int s : item.ordersArrivingAt(t)) {
                    if (excess <= 1e-9 || orders[i][s] <= 0.0) {
                        continue;
                    }
                    final double reduced = Math.max(0.0, orders[i][s] - excess);
                    final double kept = reduced < item.product().moq() ? 0.0 : reduced;
                    excess -= orders[i][s] - kept;
                    orders[i][s] = kept;
                }
            }

            for (int i = 0; i < n; i++) {
                final ItemModel item = items.get(i);
                final double available = stock[i] + item.receipts(t) + arriving(item, t, orders[i]);
                final double shortage = Math.max(0.0, item.demand(t) - available);
                stock[i] = Math.max(0.0, available - item.demand(t));
                values[item.inventory(t).index()] = stock[i];
                values[item.shortage(t).index()] = shortage;
                values[item.safetyStock(t).index()] = item.safetyStockTarget(t);
                values[item.reorderPoint(t).index()] = item.leadTimeDemand(t) + item.safetyStockTarget(t);
            }
        }

        for (int i = 0; i < n; i++) {
            final ItemModel item = items.get(i);
            for (int t = 0; t < periods; t++) {
                values[item.orderQty(t).index()] = orders[i][t];
                values[item.orderPlaced(t).index()] = orders[i][t] > 0.0 ? 1.0 : 0.0;
            }
        }
        return true;
    }

    /**
     * Order up to the reorder point when the position, stock plus everything still due, is below it.
     */
    private static double orderAt(final ItemModel item, final int t, final double stock, final double[] orders) {
        if (!item.canArrive(t)) {
            return 0.0;
        }
        double position = stock;
        for (int s = t; s < item.periods(); s++) {
            position += item.receipts(s);
        }
        for (int s = 0; s < t; s++) {
            if (item.arrivalOf(s) >= t && item.canArrive(s)) {
                position += orders[s];
            }
        }
        final double reorderPoint = item.leadTimeDemand(t) + item.safetyStockTarget(t);
        if (position >= reorderPoint) {
            return 0.0;
        }
        final double quantity = Math.max(item.product().moq(), reorderPoint - position);
        return Math.min(quantity, item.orderQty(t).upperBound());
    }

    private static double arriving(final ItemModel item, final int t, final double[] orders) {
        double total = 0.0;
        for (final int s : item.ordersArrivingAt(t)) {
            total += orders[s];
        }
        return total;
    }

    private static long elapsed(final long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
