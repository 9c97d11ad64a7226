/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.optimizer.OptimizationProblem;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.PolicyExtractor;
import com.vmware.replenish.optimizer.ProblemBuilder;
import com.vmware.replenish.optimizer.Relaxation;
import com.vmware.replenish.optimizer.ReplenishmentException;
import com.vmware.replenish.optimizer.Solution;
import com.vmware.replenish.optimizer.Solver;
import com.vmware.replenish.optimizer.ValidationException;

/**
 * Synchronous what-if planning over a snapshot. Uses the same builder, solver and extractor
 * as a cycle but neither repairs nor persists: the records carry the raw solver status.
 */
public class ReplenishmentService {
    protected Logger LOG = LogManager.getLogger(ReplenishmentService.class);

    private final OptimizerConfig config;
    private final Solver solver;
    private final PlanningSnapshot snapshot;
    private final ProblemBuilder builder;
    private final PolicyExtractor extractor;

    public ReplenishmentService(final OptimizerConfig config, final Solver solver, final PlanningSnapshot snapshot) {
        this.config = config;
        this.solver = solver;
        this.snapshot = snapshot;
        this.builder = new ProblemBuilder(config);
        this.extractor = new PolicyExtractor(config);
    }

    /**
     * Plan the given products at the given locations.
     *
     * @param productIds  products to plan
     * @param locationIds locations to plan them at
     * @param horizon     the planning window
     * @return one record per planned (product, location, period); zero quantities with the
     *         raw status when the solve did not produce a usable plan
     * @throws ValidationException if the input is invalid
     */
    public List<Policy> solvePartition(final List<String> productIds, final List<String> locationIds,
                                       final Horizon horizon) throws ValidationException {
        for (final String locationId : locationIds) {
            if (snapshot.location(locationId) == null) {
                throw new ValidationException("Unknown location " + locationId);
            }
        }
        for (final String productId : productIds) {
            if (snapshot.product(productId) == null) {
                throw new ValidationException("Unknown product " + productId);
            }
        }
        final Partition partition = new Partition("what-if", productIds, locationIds);
        final OptimizationProblem problem = builder.build(partition, snapshot, horizon, Relaxation.NOMINAL);
        final Solution solution = solver.solve(problem, config.timeLimitMillis(), config.gapTolerance());
        try {
            return extractor.extract(problem, solution).policies();
        } catch (final ReplenishmentException e) {
            LOG.warn("What-if solve returned no usable plan: {}", e.getMessage());
            final List<Policy> placeholders = new ArrayList<>();
            for (final ItemKey item : partition.items(snapshot, horizon)) {
                for (int t = 0; t < horizon.length(); t++) {
                    placeholders.add(Policy.failed(item.at(horizon.period(t)), solution.status()));
                }
            }
            return placeholders;
        }
    }
}
