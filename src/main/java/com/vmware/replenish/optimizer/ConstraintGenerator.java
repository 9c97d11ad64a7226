/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.List;

import com.vmware.replenish.model.Location;

/**
 * Generates the structural constraints of a problem whose variables are already declared.
 * Constraints are emitted item by item and period by period, then location by location,
 * so the same problem always yields the same constraint order.
 */
public class ConstraintGenerator {

    public void generate(final OptimizationProblem problem) {
        for (final ItemModel item : problem.items()) {
            balance(problem, item);
            orderLinking(problem, item);
            safetyStock(problem, item);
        }
        for (final Location location : problem.locations()) {
            capacity(problem, location, problem.itemsAt(location.locationId()));
        }
    }

    /**
     * inventory[t] - inventory[t-1] - orders arriving at t - shortage[t] = receipts[t] - demand[t],
     * with the on hand stock standing in for inventory[-1].
     */
    private void balance(final OptimizationProblem problem, final ItemModel item) {
        for (int t = 0; t < item.periods(); t++) {
            final LinearExpression expr = new LinearExpression().add(item.inventory(t), 1.0);
            double rhs = item.receipts(t) - item.demand(t);
            if (t == 0) {
                rhs += item.onHand();
            } else {
                expr.add(item.inventory(t - 1), -1.0);
            }
            for (final int s : item.ordersArrivingAt(t)) {
                expr.add(item.orderQty(s), -1.0);
            }
            expr.add(item.shortage(t), -1.0);
            problem.addConstraint(new LinearConstraint(name("balance", item, t), rhs, rhs, expr));
        }
    }

    private void orderLinking(final OptimizationProblem problem, final ItemModel item) {
        final double moq = item.product().moq();
        for (int t = 0; t < item.periods(); t++) {
            final Variable qty = item.orderQty(t);
            final Variable placed = item.orderPlaced(t);
            problem.addConstraint(new LinearConstraint(name("order_link", item, t),
                    Double.NEGATIVE_INFINITY, 0.0,
                    new LinearExpression().add(qty, 1.0).add(placed, -qty.upperBound())));
            if (moq > 0.0) {
                problem.addConstraint(new LinearConstraint(name("moq", item, t),
                        0.0, Double.POSITIVE_INFINITY,
                        new LinearExpression().add(qty, 1.0).add(placed, -moq)));
            }
        }
    }

    private void safetyStock(final OptimizationProblem problem, final ItemModel item) {
        final int firstArrival = item.firstArrival();
        for (int t = 0; t < item.periods(); t++) {
            problem.addConstraint(new LinearConstraint(name("safety_stock_target", item, t),
                    item.safetyStockTarget(t), Double.POSITIVE_INFINITY,
                    new LinearExpression().add(item.safetyStock(t), 1.0)));
            if (t >= firstArrival) {
                problem.addConstraint(new LinearConstraint(name("safety_stock_coverage", item, t),
                        0.0, Double.POSITIVE_INFINITY,
                        new LinearExpression().add(item.inventory(t), 1.0).add(item.safetyStock(t), -1.0)));
            }
            problem.addConstraint(new LinearConstraint(name("reorder_point", item, t),
                    item.leadTimeDemand(t), item.leadTimeDemand(t),
                    new LinearExpression().add(item.reorderPoint(t), 1.0).add(item.safetyStock(t), -1.0)));
        }
    }

    /**
     * End of period stock and stock on receipt, both summed over every product at the location.
     */
    private void capacity(final OptimizationProblem problem, final Location location, final List<ItemModel> items) {
        final int periods = problem.horizon().length();
        for (int t = 0; t < periods; t++) {
            final LinearExpression stored = new LinearExpression();
            final LinearExpression received = new LinearExpression();
            double fixedInflow = 0.0;
            for (final ItemModel item : items) {
                stored.add(item.inventory(t), 1.0);
                if (t == 0) {
                    fixedInflow += item.onHand();
                } else {
                    received.add(item.inventory(t - 1), 1.0);
                }
                fixedInflow += item.receipts(t);
                for (final int s : item.ordersArrivingAt(t)) {
                    received.add(item.orderQty(s), 1.0);
                }
            }
            final String suffix = "[" + location.locationId() + "," + t + "]";
            problem.addConstraint(new LinearConstraint("capacity" + suffix,
                    Double.NEGATIVE_INFINITY, location.capacity(), stored));
            problem.addConstraint(new LinearConstraint("receiving_capacity" + suffix,
                    Double.NEGATIVE_INFINITY, location.capacity() - fixedInflow, received));
        }
    }

    private static String name(final String kind, final ItemModel item, final int t) {
        return kind + "[" + item.key().productId() + "," + item.key().locationId() + "," + t + "]";
    }
}
