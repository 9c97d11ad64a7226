/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.model.Resolution;

/**
 * Turns an accepted solution into policy records. Order quantities are rounded to the
 * configured granularity and the rounded plan is re-checked against MOQ and receiving
 * capacity, then replayed under lost sales to report the cost it actually incurs. On a
 * backlog relaxed problem, orders rounded over the receiving capacity are rounded down
 * instead of rejected.
 */
public class PolicyExtractor {
    protected Logger LOG = LogManager.getLogger(PolicyExtractor.class);

    private static final double TOLERANCE = 1e-6;

    private final OptimizerConfig config;

    public PolicyExtractor(final OptimizerConfig config) {
        this.config = config;
    }

    /**
     * Policies and realized costs of one extracted plan.
     */
    public record ExtractionResult(List<Policy> policies, double objectiveValue, double realizedHoldingCost,
                                   double realizedShortageUnits, double realizedShortageCost,
                                   double realizedOrderingCost) {

        public double realizedTotalCost() {
            return realizedHoldingCost + realizedShortageCost + realizedOrderingCost;
        }
    }

    /**
     * Extract the policies of a solved problem, in item then period order.
     *
     * @param problem  the problem that was solved
     * @param solution its solution
     * @return policy records marked {@link Resolution#SOLVED} with the solution's status
     * @throws InfeasibleModelException if the solution proves the model infeasible
     * @throws SolverTimeoutException   if no acceptable solution was found in time
     * @throws SolverException          if the backend failed
     * @throws PolicyRoundingException  if the rounded plan breaks MOQ or capacity and cannot be
     *                                  rounded down
     */
    public ExtractionResult extract(final OptimizationProblem problem, final Solution solution)
            throws ReplenishmentException {
        switch (solution.status()) {
            case OPTIMAL:
            case FEASIBLE_SUBOPTIMAL:
                break;
            case INFEASIBLE:
                throw new InfeasibleModelException("Partition " + problem.partition().partitionId()
                        + " is infeasible: " + solution.message());
            case TIMED_OUT:
                throw new SolverTimeoutException("Partition " + problem.partition().partitionId()
                        + " timed out: " + solution.message());
            default:
                throw new SolverException("Partition " + problem.partition().partitionId()
                        + " failed: " + solution.message());
        }

        final Map<ItemModel, double[]> orders = new HashMap<>();
        for (final ItemModel item : problem.items()) {
            final double[] rounded = new double[item.periods()];
            for (int t = 0; t < item.periods(); t++) {
                rounded[t] = roundOrder(solution.value(item.orderQty(t)), item.product().moq());
                if (rounded[t] > 0.0 && !item.canArrive(t)) {
                    throw new PolicyRoundingException("Order for " + item.key() + " at offset " + t
                            + " cannot arrive inside the horizon");
                }
                if (rounded[t] > 0.0 && rounded[t] < item.product().moq() - TOLERANCE) {
                    throw new PolicyRoundingException("Order of " + rounded[t] + " for " + item.key()
                            + " is below the MOQ of " + item.product().moq());
                }
            }
            orders.put(item, rounded);
        }

        Map<ItemModel, double[]> stock = replay(problem, orders);
        for (ReceivingViolation violation = firstViolation(problem, orders, stock); violation != null;
             violation = firstViolation(problem, orders, stock)) {
            if (!problem.relaxation().unboundedBacklog() || !roundDown(problem, orders, violation)) {
                throw new PolicyRoundingException(violation.describe());
            }
            stock = replay(problem, orders);
        }

        double holding = 0.0;
        double shortageUnits = 0.0;
        double shortageCost = 0.0;
        double ordering = 0.0;
        final List<Policy> policies = new ArrayList<>();
        for (final ItemModel item : problem.items()) {
            final Product product = item.product();
            final double[] plan = orders.get(item);
            final double[] onHand = stock.get(item);
            double previous = item.onHand();
            for (int t = 0; t < item.periods(); t++) {
                final double available = previous + item.receipts(t) + arriving(item, t, plan);
                final double lost = Math.max(0.0, item.demand(t) - available);
                holding += product.holdingCost() * onHand[t];
                shortageUnits += lost;
                shortageCost += product.shortageCost() * lost;
                ordering += plan[t] > 0.0 ? product.orderingCost() : 0.0;
                previous = onHand[t];

                final double safetyStock = round(solution.value(item.safetyStock(t)));
                final double reorderPoint = Math.max(safetyStock, round(solution.value(item.reorderPoint(t))));
                final double periodCost = product.holdingCost() * solution.value(item.inventory(t))
                        + product.shortageCost() * solution.value(item.shortage(t))
                        + product.orderingCost() * solution.value(item.orderPlaced(t));
                policies.add(new Policy(product.productId(), item.location().locationId(),
                        problem.horizon().period(t), plan[t], safetyStock, reorderPoint, solution.status(),
                        round(periodCost), Resolution.SOLVED));
            }
        }

        LOG.debug("Extracted {} policies for partition {}: holding={}, shortageUnits={}, shortageCost={}, "
                        + "ordering={}", policies.size(), problem.partition().partitionId(), holding, shortageUnits,
                shortageCost, ordering);
        return new ExtractionResult(policies, round(solution.objectiveValue()), round(holding),
                round(shortageUnits), round(shortageCost), round(ordering));
    }

    /**
     * Nearest multiple of the granularity, or the next multiple at or above the MOQ when
     * the nearest one lands strictly between zero and the MOQ.
     */
    double roundOrder(final double quantity, final double moq) {
        final double granularity = config.orderGranularity();
        if (quantity <= TOLERANCE) {
            return 0.0;
        }
        double rounded = Math.round(quantity / granularity) * granularity;
        if (rounded > 0.0 && rounded < moq - TOLERANCE) {
            rounded = Math.ceil(moq / granularity - TOLERANCE) * granularity;
        }
        return round(rounded);
    }

    /**
     * Half up rounding to the configured decimal precision, never negative.
     */
    double round(final double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        final double rounded = BigDecimal.valueOf(value)
                .setScale(config.decimalPrecision(), RoundingMode.HALF_UP)
                .doubleValue();
        return rounded <= 0.0 ? 0.0 : rounded;
    }

    private static Map<ItemModel, double[]> replay(final OptimizationProblem problem,
                                                   final Map<ItemModel, double[]> orders) {
        final Map<ItemModel, double[]> stock = new HashMap<>();
        for (final ItemModel item : problem.items()) {
            final double[] plan = orders.get(item);
            final double[] onHand = new double[item.periods()];
            double previous = item.onHand();
            for (int t = 0; t < item.periods(); t++) {
                final double available = previous + item.receipts(t) + arriving(item, t, plan);
                onHand[t] = Math.max(0.0, available - item.demand(t));
                previous = onHand[t];
            }
            stock.put(item, onHand);
        }
        return stock;
    }

    /**
     * A period in which a location receives more than it can hold.
     */
    private record ReceivingViolation(Location location, int offset, int period, double received) {

        String describe() {
            return String.format("Rounded plan receives %.6f units at location %s in period %d, capacity is %.6f",
                    received, location.locationId(), period, location.capacity());
        }
    }

    private static ReceivingViolation firstViolation(final OptimizationProblem problem,
                                                     final Map<ItemModel, double[]> orders,
                                                     final Map<ItemModel, double[]> stock) {
        for (final Location location : problem.locations()) {
            for (int t = 0; t < problem.horizon().length(); t++) {
                double received = 0.0;
                boolean ordersLand = false;
                for (final ItemModel item : problem.itemsAt(location.locationId())) {
                    final double arrivals = arriving(item, t, orders.get(item));
                    ordersLand |= arrivals > 0.0;
                    received += (t == 0 ? item.onHand() : stock.get(item)[t - 1]) + item.receipts(t) + arrivals;
                }
                // Stock already committed before any order lands is not the plan's doing
                if (ordersLand && received > location.capacity() + TOLERANCE) {
                    return new ReceivingViolation(location, t, problem.horizon().period(t), received);
                }
            }
        }
        return null;
    }

    /**
     * Lower one order landing in the violating period to the next multiple of the granularity
     * below it, or to zero below the MOQ. Unmet demand grows accordingly, which only a backlog
     * relaxed problem admits.
     *
     * @return false if no order lands in that period
     */
    private boolean roundDown(final OptimizationProblem problem, final Map<ItemModel, double[]> orders,
                              final ReceivingViolation violation) {
        final List<ItemModel> items = problem.itemsAt(violation.location().locationId());
        for (int i = items.size() - 1; i >= 0; i--) {
            final ItemModel item = items.get(i);
            final double[] plan = orders.get(item);
            for (final int s : item.ordersArrivingAt(violation.offset())) {
                if (plan[s] <= 0.0) {
                    continue;
                }
                double lowered = round(plan[s] - config.orderGranularity());
                if (lowered < item.product().moq() - TOLERANCE || lowered <= TOLERANCE) {
                    lowered = 0.0;
                }
                LOG.info("Rounding order for {} at offset {} down from {} to {}: {}", item.key(), s, plan[s],
                        lowered, violation.describe());
                plan[s] = lowered;
                return true;
            }
        }
        return false;
    }

    private static double arriving(final ItemModel item, final int t, final double[] plan) {
        double total = 0.0;
        for (final int s : item.ordersArrivingAt(t)) {
            total += plan[s];
        }
        return total;
    }
}
