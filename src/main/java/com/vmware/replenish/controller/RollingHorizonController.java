/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.controller;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PeriodKey;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Resolution;
import com.vmware.replenish.model.SolverStatus;
import com.vmware.replenish.optimizer.InfeasibleModelException;
import com.vmware.replenish.optimizer.ItemModel;
import com.vmware.replenish.optimizer.OptimizationProblem;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.PolicyExtractor;
import com.vmware.replenish.optimizer.PolicyExtractor.ExtractionResult;
import com.vmware.replenish.optimizer.PolicyRoundingException;
import com.vmware.replenish.optimizer.ProblemBuilder;
import com.vmware.replenish.optimizer.Relaxation;
import com.vmware.replenish.optimizer.ReplenishmentException;
import com.vmware.replenish.optimizer.Solution;
import com.vmware.replenish.optimizer.Solver;
import com.vmware.replenish.optimizer.SolverException;
import com.vmware.replenish.optimizer.SolverTimeoutException;
import com.vmware.replenish.optimizer.ValidationException;
import com.vmware.replenish.store.PolicyStore;

/**
 * Runs planning cycles. Each partition goes through build, solve and extract on a bounded
 * worker pool; failed solves walk a repair ladder, timed out solves fall back to the last
 * known good policies. Once every partition is done the policies are persisted in
 * partition order.
 */
public class RollingHorizonController {
    protected Logger LOG = LogManager.getLogger(RollingHorizonController.class);

    private final OptimizerConfig config;
    private final Solver solver;
    private final Solver heuristic;
    private final PolicyStore store;
    private final ProblemBuilder builder;
    private final PolicyExtractor extractor;

    /**
     * @param config    optimizer and controller settings
     * @param solver    the MILP solver
     * @param heuristic the solver of last resort in the repair ladder
     * @param store     sink of the policies and source of the last known good ones
     */
    public RollingHorizonController(final OptimizerConfig config, final Solver solver, final Solver heuristic,
                                    final PolicyStore store) {
        this.config = config;
        this.solver = solver;
        this.heuristic = heuristic;
        this.store = store;
        this.builder = new ProblemBuilder(config);
        this.extractor = new PolicyExtractor(config);
    }

    /**
     * Plan every partition of a cycle and persist the policies.
     *
     * @param context the cycle to run
     * @return one outcome per partition, in partition order
     * @throws PartialBatchFailureException if the failed fraction exceeds the configured threshold;
     *                                      the policies are persisted regardless
     * @throws InterruptedException         if interrupted while waiting for the workers
     */
    public BatchReport runCycle(final CycleContext context) throws PartialBatchFailureException, InterruptedException {
        final long start = System.nanoTime();
        LOG.info("Cycle {}: planning {} partitions over periods {}..{} with {} workers", context.cycleId(),
                context.partitions().size(), context.horizon().startPeriod(), context.horizon().endPeriod(),
                config.workers());

        // The store is only touched from this thread
        final Map<String, List<Policy>> priorPolicies = new HashMap<>();
        final Map<String, Long> timeLimits = new HashMap<>();
        for (final Partition partition : context.partitions()) {
            priorPolicies.put(partition.partitionId(), store.lastKnownGood(partition.partitionId()));
            final boolean resolve = store.isResolveRequested(partition.partitionId());
            timeLimits.put(partition.partitionId(), resolve
                    ? (long) (config.timeLimitMillis() * config.resolveTimeLimitMultiplier())
                    : config.timeLimitMillis());
        }

        final List<Callable<PartitionOutcome>> tasks = new ArrayList<>();
        for (final Partition partition : context.partitions()) {
            tasks.add(() -> run(context, partition, priorPolicies.get(partition.partitionId()),
                    timeLimits.get(partition.partitionId())));
        }

        final List<PartitionOutcome> outcomes = new ArrayList<>();
        if (!tasks.isEmpty()) {
            final ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.workers(), tasks.size()),
                    new WorkerFactory(context.cycleId()));
            try {
                final List<Future<PartitionOutcome>> futures = pool.invokeAll(tasks);
                for (int i = 0; i < futures.size(); i++) {
                    outcomes.add(collect(futures.get(i), context.partitions().get(i), context));
                }
            } finally {
                pool.shutdownNow();
            }
        }

        for (final PartitionOutcome outcome : outcomes) {
            persist(context.cycleId(), outcome);
        }

        final BatchReport report = new BatchReport(context.cycleId(), outcomes,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        LOG.info("Cycle {} done in {}ms: {} partitions, {} failed, resolutions {}", context.cycleId(),
                report.wallTimeMillis(), outcomes.size(), report.failedCount(), report.resolutionCounts());
        if (report.failedFraction() > config.partialFailureThreshold()) {
            LOG.error("Cycle {}: failed fraction {} above threshold {}", context.cycleId(),
                    report.failedFraction(), config.partialFailureThreshold());
            throw new PartialBatchFailureException(report);
        }
        return report;
    }

    private PartitionOutcome collect(final Future<PartitionOutcome> future, final Partition partition,
                                     final CycleContext context) throws InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            // Workers catch everything; this only guards against errors thrown past them
            LOG.error("Partition {} worker died", partition.partitionId(), e.getCause());
            final PartitionOutcome outcome = new PartitionOutcome(partition.partitionId());
            fail(outcome, partition, context, SolverStatus.ERROR, String.valueOf(e.getCause()));
            return outcome;
        }
    }

    private void persist(final String cycleId, final PartitionOutcome outcome) {
        store.persist(cycleId, outcome.partitionId(), outcome.policies());
        store.requestResolve(outcome.partitionId(), outcome.resolveRequested());
        if (outcome.isFailed()) {
            return;
        }
        if (outcome.resolution() != Resolution.PRIOR_CYCLE) {
            store.markLastKnownGood(outcome.partitionId(), cycleId);
        }
        outcome.enter(PartitionState.PERSISTED);
        if (outcome.resolution().isRelaxed() || outcome.resolution() == Resolution.PRIOR_CYCLE) {
            LOG.warn("Partition {} persisted with resolution {} (nominal status {})", outcome.partitionId(),
                    outcome.resolution(), outcome.nominalStatus());
        } else {
            LOG.info("Partition {} persisted ({})", outcome.partitionId(), outcome.nominalStatus());
        }
    }

    /**
     * The pipeline of one partition. Never throws.
     */
    PartitionOutcome run(final CycleContext context, final Partition partition, final List<Policy> prior,
                         final long timeLimitMillis) {
        final long start = System.nanoTime();
        final PartitionOutcome outcome = new PartitionOutcome(partition.partitionId());
        try {
            pipeline(context, partition, prior, timeLimitMillis, outcome);
        } catch (final RuntimeException e) {
            LOG.error("Partition {} failed unexpectedly", partition.partitionId(), e);
            fail(outcome, partition, context, SolverStatus.ERROR, e.toString());
        }
        outcome.setWallTimeMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return outcome;
    }

    private void pipeline(final CycleContext context, final Partition partition, final List<Policy> prior,
                          final long timeLimitMillis, final PartitionOutcome outcome) {
        outcome.enter(PartitionState.BUILDING);
        final OptimizationProblem problem;
        try {
            problem = builder.build(partition, context.snapshot(), context.horizon(), Relaxation.NOMINAL);
        } catch (final ValidationException e) {
            LOG.error("Partition {} rejected: {}", partition.partitionId(), e.getMessage());
            fail(outcome, partition, context, SolverStatus.ERROR, e.getMessage());
            return;
        }

        outcome.enter(PartitionState.SOLVING);
        final Solution solution = solver.solve(problem, timeLimitMillis, config.gapTolerance());
        outcome.setNominalStatus(solution.status());
        LOG.debug("Partition {} nominal solve: {}", partition.partitionId(), solution);
        if (solution.status() == SolverStatus.FEASIBLE_SUBOPTIMAL) {
            LOG.info("Partition {} accepted at gap {} after {}ms", partition.partitionId(), solution.gap(),
                    solution.wallTimeMillis());
        }

        try {
            if (solution.isAccepted()) {
                outcome.enter(PartitionState.EXTRACTING);
            }
            final ExtractionResult result = extractor.extract(problem, solution);
            outcome.setResult(Resolution.SOLVED, result.policies(), result);
        } catch (final SolverTimeoutException e) {
            LOG.warn("Partition {} timed out after {}ms, falling back to prior policies", partition.partitionId(),
                    timeLimitMillis);
            outcome.enter(PartitionState.REPAIRING);
            outcome.setResolveRequested(true);
            if (!prior.isEmpty()) {
                outcome.setResult(Resolution.PRIOR_CYCLE, fromPriorCycle(problem, prior), null);
            } else {
                repairWithHeuristic(context, partition, outcome);
            }
        } catch (final PolicyRoundingException e) {
            // Accepted solve, unusable rounded plan
            LOG.warn("Partition {} needs repair, rounded plan rejected: {}", partition.partitionId(),
                    e.getMessage());
            outcome.enter(PartitionState.REPAIRING);
            outcome.setNominalStatus(SolverStatus.FEASIBLE_SUBOPTIMAL);
            repair(context, partition, timeLimitMillis, outcome);
        } catch (final InfeasibleModelException | SolverException e) {
            LOG.warn("Partition {} needs repair: {}", partition.partitionId(), e.getMessage());
            outcome.enter(PartitionState.REPAIRING);
            repair(context, partition, timeLimitMillis, outcome);
        } catch (final ReplenishmentException e) {
            fail(outcome, partition, context, solution.status(), e.getMessage());
        }
    }

    private void repair(final CycleContext context, final Partition partition, final long timeLimitMillis,
                        final PartitionOutcome outcome) {
        final Relaxation[] ladder = {Relaxation.backlog(),
                Relaxation.backlogWithSafetyStock(config.repairSafetyStockScale())};
        final Resolution[] resolutions = {Resolution.RELAXED_BACKLOG, Resolution.REDUCED_SAFETY_STOCK};
        for (int i = 0; i < ladder.length; i++) {
            try {
                final OptimizationProblem relaxed = builder.build(partition, context.snapshot(), context.horizon(),
                        ladder[i]);
                final Solution solution = solver.solve(relaxed, timeLimitMillis, config.gapTolerance());
                final ExtractionResult result = extractor.extract(relaxed, solution);
                outcome.setResult(resolutions[i], withOutcome(result.policies(), outcome, resolutions[i]), result);
                return;
            } catch (final ReplenishmentException e) {
                LOG.warn("Partition {} repair {} failed: {}", partition.partitionId(), resolutions[i],
                        e.getMessage());
            }
        }
        repairWithHeuristic(context, partition, outcome);
    }

    private void repairWithHeuristic(final CycleContext context, final Partition partition,
                                     final PartitionOutcome outcome) {
        try {
            final OptimizationProblem relaxed = builder.build(partition, context.snapshot(), context.horizon(),
                    Relaxation.backlog());
            final Solution solution = heuristic.solve(relaxed, config.timeLimitMillis(), config.gapTolerance());
            final ExtractionResult result = extractor.extract(relaxed, solution);
            outcome.setResult(Resolution.HEURISTIC, withOutcome(result.policies(), outcome, Resolution.HEURISTIC),
                    result);
        } catch (final ReplenishmentException e) {
            LOG.error("Partition {} exhausted its repair options: {}", partition.partitionId(), e.getMessage());
            final SolverStatus nominal = outcome.nominalStatus();
            fail(outcome, partition, context, nominal != null && nominal.isAccepted() ? SolverStatus.ERROR : nominal,
                    e.getMessage());
        }
    }

    private static List<Policy> withOutcome(final List<Policy> policies, final PartitionOutcome outcome,
                                            final Resolution resolution) {
        final List<Policy> repaired = new ArrayList<>(policies.size());
        for (final Policy policy : policies) {
            repaired.add(policy.withOutcome(outcome.nominalStatus(), resolution));
        }
        return repaired;
    }

    /**
     * Policies of the last good cycle for the periods it covers. Later periods keep its last
     * safety stock and reorder point without ordering; items it never planned get the
     * targets of the current problem.
     */
    private static List<Policy> fromPriorCycle(final OptimizationProblem problem, final List<Policy> prior) {
        final Map<PeriodKey, Policy> byKey = new HashMap<>();
        final Map<ItemKey, Policy> latest = new HashMap<>();
        for (final Policy policy : prior) {
            byKey.put(policy.key(), policy);
            latest.merge(policy.item(), policy, (a, b) -> a.period() >= b.period() ? a : b);
        }

        final Horizon horizon = problem.horizon();
        final List<Policy> policies = new ArrayList<>();
        for (final ItemModel item : problem.items()) {
            final ItemKey key = item.key();
            for (int t = 0; t < item.periods(); t++) {
                final int period = horizon.period(t);
                final Policy known = byKey.get(key.at(period));
                final Policy last = latest.get(key);
                if (known != null) {
                    policies.add(known.withOutcome(SolverStatus.TIMED_OUT, Resolution.PRIOR_CYCLE));
                } else if (last != null) {
                    policies.add(new Policy(key.productId(), key.locationId(), period, 0.0, last.safetyStock(),
                            last.reorderPoint(), SolverStatus.TIMED_OUT, 0.0, Resolution.PRIOR_CYCLE));
                } else {
                    final double safetyStock = item.safetyStockTarget(t);
                    policies.add(new Policy(key.productId(), key.locationId(), period, 0.0, safetyStock,
                            safetyStock + item.leadTimeDemand(t), SolverStatus.TIMED_OUT, 0.0,
                            Resolution.PRIOR_CYCLE));
                }
            }
        }
        return policies;
    }

    /**
     * Mark a partition failed with zero quantity placeholders for every item period it covers.
     */
    private static void fail(final PartitionOutcome outcome, final Partition partition, final CycleContext context,
                             final SolverStatus status, final String error) {
        final SolverStatus recorded = status == null ? SolverStatus.ERROR : status;
        final List<Policy> placeholders = new ArrayList<>();
        for (final ItemKey item : partition.items(context.snapshot(), context.horizon())) {
            for (int t = 0; t < context.horizon().length(); t++) {
                placeholders.add(Policy.failed(item.at(context.horizon().period(t)), recorded));
            }
        }
        if (outcome.nominalStatus() == null) {
            outcome.setNominalStatus(recorded);
        }
        outcome.setResult(Resolution.FAILED, placeholders, null);
        outcome.setError(error);
        outcome.enter(PartitionState.FAILED);
    }

    /**
     * Names worker threads after the cycle they serve.
     */
    private static final class WorkerFactory implements ThreadFactory {
        private final String cycleId;
        private final AtomicInteger count = new AtomicInteger();

        WorkerFactory(final String cycleId) {
            this.cycleId = cycleId;
        }

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable, "planner-" + cycleId + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
