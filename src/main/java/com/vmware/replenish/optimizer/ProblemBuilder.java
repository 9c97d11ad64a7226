/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.InventoryPosition;
import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.model.RiskAdjustment;

/**
 * Assembles the optimization model of one partition: derives per-item parameters from
 * master data, forecasts and risk adjustments, declares the decision variables and both
 * objectives, and hands the structural constraints to the {@link ConstraintGenerator}.
 */
public class ProblemBuilder {
    protected Logger LOG = LogManager.getLogger(ProblemBuilder.class);

    private final OptimizerConfig config;
    private final SafetyStockCalculator safetyStock;
    private final ConstraintGenerator constraints;

    public ProblemBuilder(final OptimizerConfig config) {
        this.config = config;
        this.safetyStock = new SafetyStockCalculator(config.safetyStockMethod());
        this.constraints = new ConstraintGenerator();
    }

    /**
     * Build the model of a partition.
     *
     * @param partition  the products and locations to plan together
     * @param snapshot   read-only cycle data
     * @param horizon    the planning window
     * @param relaxation soft-constraint settings, {@link Relaxation#NOMINAL} for the first attempt
     * @return a problem owned by the caller
     * @throws ValidationException if the horizon is empty or master or forecast data is missing or malformed
     */
    public OptimizationProblem build(final Partition partition, final PlanningSnapshot snapshot,
                                     final Horizon horizon, final Relaxation relaxation)
            throws ValidationException {
        if (horizon == null || horizon.isEmpty()) {
            throw new ValidationException("Partition " + partition.partitionId() + " has an empty horizon");
        }

        final OptimizationProblem problem = new OptimizationProblem(partition, horizon, relaxation);
        for (final ItemKey key : partition.items(snapshot, horizon)) {
            final Product product = validProduct(snapshot, key.productId());
            final Location location = validLocation(snapshot, key.locationId());
            problem.addItem(deriveItem(product, location, snapshot, horizon, relaxation));
        }
        if (problem.items().isEmpty()) {
            throw new ValidationException("Partition " + partition.partitionId()
                    + " has no forecast items in periods " + horizon.startPeriod() + ".." + horizon.endPeriod());
        }

        for (final ItemModel item : problem.items()) {
            declareVariables(problem, item);
        }
        constraints.generate(problem);

        LOG.debug("Built partition {}: items={}, variables={}, constraints={}, relaxation={}",
                partition.partitionId(), problem.items().size(), problem.numVariables(),
                problem.numConstraints(), relaxation);
        return problem;
    }

    private Product validProduct(final PlanningSnapshot snapshot, final String productId)
            throws ValidationException {
        final Product product = snapshot.product(productId);
        if (product == null) {
            throw new ValidationException("Unknown product " + productId);
        }
        requireNonNegative(product.holdingCost(), "holding_cost", productId);
        requireNonNegative(product.shortageCost(), "shortage_cost", productId);
        requireNonNegative(product.orderingCost(), "ordering_cost", productId);
        requireNonNegative(product.moq(), "moq", productId);
        if (product.leadTime() < 0) {
            throw new ValidationException("Product " + productId + " has negative lead_time");
        }
        return product;
    }

    private Location validLocation(final PlanningSnapshot snapshot, final String locationId)
            throws ValidationException {
        final Location location = snapshot.location(locationId);
        if (location == null) {
            throw new ValidationException("Unknown location " + locationId);
        }
        // Negative capacity is legal input; it makes the model infeasible rather than invalid
        if (Double.isNaN(location.capacity())) {
            throw new ValidationException("Location " + locationId + " has no capacity");
        }
        final double serviceLevel = location.serviceLevelTarget();
        if (!(serviceLevel > 0.0 && serviceLevel < 1.0)) {
            throw new ValidationException("Location " + locationId + " service_level_target must be in (0, 1): "
                    + serviceLevel);
        }
        return location;
    }

    private static void requireNonNegative(final double value, final String field, final String owner)
            throws ValidationException {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new ValidationException(owner + " has invalid " + field + ": " + value);
        }
    }

    private ItemModel deriveItem(final Product product, final Location location, final PlanningSnapshot snapshot,
                                 final Horizon horizon, final Relaxation relaxation) throws ValidationException {
        final ItemKey key = new ItemKey(product.productId(), location.locationId());
        final int periods = horizon.length();

        final DemandForecast[] forecasts = new DemandForecast[periods];
        final double[] varianceMultiplier = new double[periods];
        final int[] leadTime = new int[periods];
        final double[] demand = new double[periods];
        for (int t = 0; t < periods; t++) {
            final DemandForecast forecast = snapshot.forecast(key.at(horizon.period(t)));
            forecasts[t] = validForecast(forecast, key, horizon.period(t));
            demand[t] = forecasts[t].mean();

            final RiskAdjustment risk = snapshot.risk(key.at(horizon.period(t)));
            final double leadTimeMultiplier = risk.leadTimeMultiplier()
                    * (risk.shock() ? config.shockLeadTimeFactor() : 1.0);
            final double varianceScale = risk.demandVarianceMultiplier()
                    * (risk.shock() ? config.shockVarianceFactor() : 1.0);
            if (!(leadTimeMultiplier > 0.0) || !(varianceScale > 0.0)
                    || !Double.isFinite(leadTimeMultiplier) || !Double.isFinite(varianceScale)) {
                throw new ValidationException("Invalid risk multipliers for " + key + " at period "
                        + horizon.period(t));
            }
            // Small epsilon keeps 2 * 1.5 = 3.0000000000000004 at 3 periods
            leadTime[t] = (int) Math.ceil(product.leadTime() * leadTimeMultiplier - 1e-9);
            varianceMultiplier[t] = varianceScale;
        }

        final double[] leadTimeDemand = new double[periods];
        final double[] target = new double[periods];
        for (int t = 0; t < periods; t++) {
            // Protection window: the lead time plus one review period, flat beyond the horizon
            final int windowLength = leadTime[t] + 1;
            final List<DemandForecast> window = new ArrayList<>(windowLength);
            final double[] windowMultipliers = new double[windowLength];
            double mean = 0.0;
            for (int j = 0; j < windowLength; j++) {
                final int source = Math.min(t + j, periods - 1);
                window.add(forecasts[source]);
                windowMultipliers[j] = varianceMultiplier[source];
                mean += forecasts[source].mean();
            }
            leadTimeDemand[t] = mean;
            target[t] = safetyStock.target(window, windowMultipliers, location.serviceLevelTarget())
                    * relaxation.safetyStockScale();
        }

        final InventoryPosition position = snapshot.inventory(key);
        if (!Double.isFinite(position.onHand()) || position.onHand() < 0.0) {
            throw new ValidationException("Invalid on hand inventory for " + key + ": " + position.onHand());
        }
        final double[] receipts = new double[periods];
        for (final Map.Entry<Integer, Double> receipt : position.scheduledReceipts().entrySet()) {
            if (!Double.isFinite(receipt.getValue()) || receipt.getValue() < 0.0) {
                throw new ValidationException("Invalid scheduled receipt for " + key + " at period " + receipt.getKey());
            }
            if (horizon.contains(receipt.getKey())) {
                receipts[receipt.getKey() - horizon.startPeriod()] += receipt.getValue();
            }
        }

        final double[] shortageBound = new double[periods];
        int firstArrival = periods;
        for (int t = 0; t < periods; t++) {
            firstArrival = Math.min(firstArrival, t + leadTime[t]);
        }
        for (int t = 0; t < periods; t++) {
            // Before the first replenishment can land the service level is out of our hands
            final boolean controllable = t >= firstArrival;
            shortageBound[t] = relaxation.unboundedBacklog() || !controllable
                    ? demand[t]
                    : (1.0 - location.serviceLevelTarget()) * demand[t];
        }

        return new ItemModel(product, location, demand, leadTimeDemand, target, shortageBound, leadTime,
                position.onHand(), receipts);
    }

    private DemandForecast validForecast(final DemandForecast forecast, final ItemKey key, final int period)
            throws ValidationException {
        if (forecast == null) {
            throw new ValidationException("Missing forecast for " + key + " at period " + period);
        }
        if (!Double.isFinite(forecast.mean()) || forecast.mean() < 0.0) {
            throw new ValidationException("Invalid forecast mean for " + key + " at period " + period);
        }
        for (final Map.Entry<Double, Double> quantile : forecast.quantiles().entrySet()) {
            if (!(quantile.getKey() > 0.0 && quantile.getKey() < 1.0) || !Double.isFinite(quantile.getValue())) {
                throw new ValidationException("Invalid forecast quantile " + quantile.getKey() + " for " + key
                        + " at period " + period);
            }
        }
        final double sigma = SafetyStockCalculator.standardDeviation(forecast);
        if (!Double.isFinite(sigma) || sigma < 0.0) {
            throw new ValidationException("Forecast for " + key + " at period " + period
                    + " has no usable dispersion");
        }
        return forecast;
    }

    private void declareVariables(final OptimizationProblem problem, final ItemModel item) {
        final int periods = item.periods();
        final Product product = item.product();
        final String suffix = item.key().productId() + "," + item.key().locationId();

        final Variable[] orderQty = new Variable[periods];
        final Variable[] orderPlaced = new Variable[periods];
        final Variable[] inventory = new Variable[periods];
        final Variable[] shortage = new Variable[periods];
        final Variable[] safety = new Variable[periods];
        final Variable[] reorderPoint = new Variable[periods];

        double maxTarget = 0.0;
        for (int t = 0; t < periods; t++) {
            maxTarget = Math.max(maxTarget, item.safetyStockTarget(t));
        }

        for (int t = 0; t < periods; t++) {
            final double bigM = item.canArrive(t) ? orderBound(item, t, maxTarget) : 0.0;
            orderQty[t] = problem.newVariable("order_qty[" + suffix + "," + t + "]", 0.0, bigM,
                    config.integerOrders());
            orderPlaced[t] = problem.newVariable("order_placed[" + suffix + "," + t + "]", 0.0,
                    bigM > 0.0 ? 1.0 : 0.0, true);
            inventory[t] = problem.newVariable("inventory[" + suffix + "," + t + "]", 0.0,
                    Double.POSITIVE_INFINITY, false);
            shortage[t] = problem.newVariable("shortage[" + suffix + "," + t + "]", 0.0,
                    item.shortageBound(t), false);
            safety[t] = problem.newVariable("safety_stock[" + suffix + "," + t + "]", 0.0,
                    Double.POSITIVE_INFINITY, false);
            reorderPoint[t] = problem.newVariable("reorder_point[" + suffix + "," + t + "]", 0.0,
                    Double.POSITIVE_INFINITY, false);

            problem.primaryObjective()
                    .add(inventory[t], product.holdingCost())
                    .add(shortage[t], product.shortageCost())
                    .add(orderPlaced[t], product.orderingCost());
            if (config.tieBreak() == OptimizerConfig.TieBreak.ORDER_COUNT) {
                problem.secondaryObjective().add(orderPlaced[t], 1.0);
            }
            // Pins safety stock to its target among cost optima
            problem.secondaryObjective().add(safety[t], 1.0);
        }
        item.attach(orderQty, orderPlaced, inventory, shortage, safety, reorderPoint);
    }

    /**
     * Big-M of the MOQ link: no single order needs to exceed the demand left after it lands
     * plus the largest safety stock, nor the location capacity, unless the MOQ forces it.
     */
    private static double orderBound(final ItemModel item, final int t, final double maxTarget) {
        double need = maxTarget;
        for (int s = item.arrivalOf(t); s < item.periods(); s++) {
            need += item.demand(s);
        }
        final double capped = Math.max(0.0, Math.min(item.location().capacity(), need));
        return Math.max(item.product().moq(), capped);
    }
}
