/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.simulation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.controller.BatchReport;
import com.vmware.replenish.controller.CycleContext;
import com.vmware.replenish.controller.PartialBatchFailureException;
import com.vmware.replenish.controller.Partitioner;
import com.vmware.replenish.controller.RollingHorizonController;
import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.InventoryPosition;
import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.model.RiskAdjustment;
import com.vmware.replenish.optimizer.OptimizerConfig;

/**
 * Rolling simulation of a synthetic network. Each step plans the current horizon, places
 * the orders of its first period, realizes Poisson demand against the stock and moves the
 * horizon one period forward.
 */
public class Simulation {
    protected Logger LOG = LogManager.getLogger(Simulation.class);

    /** Probability that an item period carries a risk event. */
    static final double RISK_PROBABILITY = 0.05;

    protected final RollingHorizonController controller;
    protected final OptimizerConfig config;
    protected final RandomDataGenerator rand;
    protected final int maxItemsPerPartition;
    protected final SimulationSummary summary = new SimulationSummary();
    protected PlanningSnapshot snapshot;
    protected Horizon horizon;

    /**
     * @param controller           plans each cycle
     * @param config               settings the controller was built with
     * @param randomSeed           seed for the synthetic data and demand, null for a random one
     * @param numProducts          products stocked at every location
     * @param numLocations         number of locations
     * @param horizonLength        periods planned per cycle
     * @param numCycles            cycles the generated forecasts must cover
     * @param maxItemsPerPartition item budget of a partition
     */
    public Simulation(final RollingHorizonController controller, final OptimizerConfig config,
                      final Integer randomSeed, final int numProducts, final int numLocations,
                      final int horizonLength, final int numCycles, final int maxItemsPerPartition) {
        assert numProducts > 0;
        assert numLocations > 0;
        assert horizonLength > 0;
        assert numCycles >= 0;
        assert maxItemsPerPartition > 0;

        this.controller = controller;
        this.config = config;
        this.maxItemsPerPartition = maxItemsPerPartition;
        if (randomSeed == null) {
            this.rand = new RandomDataGenerator();
        } else {
            this.rand = new RandomDataGenerator(new JDKRandomGenerator(randomSeed));
        }
        this.snapshot = generate(numProducts, numLocations, horizonLength + numCycles);
        this.horizon = new Horizon(0, horizonLength);
    }

    /**
     * Generate master data, forecasts for the given number of periods, a sprinkling of risk
     * events and some initial stock.
     */
    protected PlanningSnapshot generate(final int numProducts, final int numLocations, final int periods) {
        final PlanningSnapshot.Builder builder = PlanningSnapshot.builder();
        final double[] baseMean = new double[numProducts];
        double capacityNeed = 0.0;
        for (int p = 0; p < numProducts; p++) {
            final int moq = rand.nextInt(0, 2) * 10;
            final int leadTime = rand.nextInt(0, 3);
            builder.addProduct(new Product(productId(p), rand.nextUniform(0.5, 2.0), rand.nextUniform(5.0, 20.0),
                    rand.nextUniform(10.0, 60.0), moq, leadTime));
            baseMean[p] = rand.nextUniform(10.0, 50.0);
            capacityNeed += baseMean[p] * (leadTime + 3);
        }

        for (int l = 0; l < numLocations; l++) {
            final String locationId = locationId(l);
            builder.addLocation(new Location(locationId, Math.ceil(capacityNeed * 1.5),
                    rand.nextUniform(0.85, 0.98)));
            for (int p = 0; p < numProducts; p++) {
                for (int t = 0; t < periods; t++) {
                    final double mean = Math.max(0.0, baseMean[p] * rand.nextUniform(0.8, 1.2));
                    builder.addForecast(DemandForecast.normal(productId(p), locationId, t, mean,
                            mean * rand.nextUniform(0.1, 0.3)));
                    if (rand.nextUniform(0.0, 1.0) < RISK_PROBABILITY) {
                        builder.addRisk(randomRisk(productId(p), locationId, t));
                    }
                }
                builder.setInventory(new InventoryPosition(productId(p), locationId,
                        Math.floor(baseMean[p] * rand.nextUniform(0.0, 2.0)), null));
            }
        }
        return builder.build();
    }

    private RiskAdjustment randomRisk(final String productId, final String locationId, final int period) {
        switch (rand.nextInt(0, 2)) {
            case 0:
                return new RiskAdjustment(productId, locationId, period, rand.nextUniform(1.0, 2.0), 1.0, false);
            case 1:
                return new RiskAdjustment(productId, locationId, period, 1.0, rand.nextUniform(1.0, 3.0), false);
            default:
                return new RiskAdjustment(productId, locationId, period, 1.0, 1.0, true);
        }
    }

    static String productId(final int index) {
        return String.format("P%03d", index + 1);
    }

    static String locationId(final int index) {
        return String.format("L%02d", index + 1);
    }

    public PlanningSnapshot snapshot() {
        return snapshot;
    }

    public Horizon horizon() {
        return horizon;
    }

    public SimulationSummary summary() {
        return summary;
    }

    /**
     * Run a number of consecutive cycles.
     */
    public SimulationSummary run(final int cycles) throws InterruptedException {
        for (int i = 0; i < cycles; i++) {
            step();
        }
        LOG.info("Simulation complete: {}", summary);
        return summary;
    }

    /**
     * Plan the current horizon, then play out its first period.
     *
     * @return the report of the cycle
     */
    public BatchReport step() throws InterruptedException {
        final int current = horizon.startPeriod();
        final List<Partition> partitions = Partitioner.byLocation(snapshot, horizon, maxItemsPerPartition);
        final CycleContext context = new CycleContext("cycle-" + current, horizon, snapshot, partitions);

        BatchReport report;
        boolean partialFailure = false;
        try {
            report = controller.runCycle(context);
        } catch (final PartialBatchFailureException e) {
            LOG.warn("Cycle {} exceeded the failure threshold, playing out what was planned", context.cycleId());
            report = e.report();
            partialFailure = true;
        }
        summary.addCycle(partialFailure, report.resolutionCounts());

        final Map<ItemKey, Double> orders = new HashMap<>();
        for (final Policy policy : report.policies()) {
            if (policy.period() == current) {
                orders.put(policy.item(), policy.orderQuantity());
            }
        }
        playOut(current, orders);
        horizon = horizon.next();
        return report;
    }

    /**
     * Place the orders of a period and serve its realized demand under lost sales.
     */
    protected void playOut(final int current, final Map<ItemKey, Double> orders) {
        final PlanningSnapshot.Builder next = snapshot.toBuilder();
        for (final Location location : snapshot.locations()) {
            for (final Product product : snapshot.products()) {
                final ItemKey item = new ItemKey(product.productId(), location.locationId());
                final DemandForecast forecast = snapshot.forecast(item.at(current));
                if (forecast == null) {
                    continue;
                }
                final InventoryPosition position = snapshot.inventory(item);
                final Map<Integer, Double> receipts = new TreeMap<>(position.scheduledReceipts());

                final double quantity = orders.getOrDefault(item, 0.0);
                if (quantity > 0.0) {
                    receipts.merge(current + leadTime(product, item, current), quantity, Double::sum);
                }

                final double available = position.onHand() + receipts.getOrDefault(current, 0.0);
                final double demand = forecast.mean() > 0.0 ? rand.nextPoisson(forecast.mean()) : 0.0;
                final double lost = Math.max(0.0, demand - available);
                final double onHand = Math.max(0.0, available - demand);
                summary.addPeriod(demand, lost, product.holdingCost() * onHand, product.shortageCost() * lost,
                        quantity > 0.0 ? product.orderingCost() : 0.0, quantity);

                receipts.keySet().removeIf(period -> period <= current);
                next.setInventory(new InventoryPosition(item.productId(), item.locationId(), onHand, receipts));
            }
        }
        snapshot = next.build();
    }

    private int leadTime(final Product product, final ItemKey item, final int period) {
        final RiskAdjustment risk = snapshot.risk(item.at(period));
        final double multiplier = risk.leadTimeMultiplier() * (risk.shock() ? config.shockLeadTimeFactor() : 1.0);
        return (int) Math.ceil(product.leadTime() * multiplier - 1e-9);
    }
}
