package com.vmware.replenish.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import com.vmware.replenish.Fixtures;
import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.model.Resolution;
import com.vmware.replenish.model.SolverStatus;
import com.vmware.replenish.optimizer.OptimizationProblem;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.OrToolsSolver;
import com.vmware.replenish.optimizer.ReorderPointHeuristic;
import com.vmware.replenish.optimizer.Solution;
import com.vmware.replenish.optimizer.Solver;
import com.vmware.replenish.store.PolicyStore;

public class TestRollingHorizonController {

    /**
     * Never finds an incumbent, remembering the time limit it was given.
     */
    private static final class TimingOutSolver implements Solver {
        private final AtomicLong lastTimeLimit = new AtomicLong();

        @Override
        public Solution solve(final OptimizationProblem problem, final long timeLimitMillis,
                              final double gapTolerance) {
            lastTimeLimit.set(timeLimitMillis);
            return Solution.rejected(SolverStatus.TIMED_OUT, "no incumbent", timeLimitMillis);
        }

        @Override
        public String name() {
            return "timing-out";
        }
    }

    /**
     * Locations L1..Ln each stocking P1 and P2 over the given periods.
     */
    private static PlanningSnapshot network(final int numLocations, final int periods) {
        final PlanningSnapshot.Builder builder = PlanningSnapshot.builder()
                .addProduct(new Product("P1", 1.0, 10.0, 20.0, 0.0, 1))
                .addProduct(new Product("P2", 0.5, 8.0, 30.0, 10.0, 0));
        for (int l = 1; l <= numLocations; l++) {
            final String locationId = "L" + l;
            builder.addLocation(new Location(locationId, 500.0, 0.9));
            for (int t = 0; t < periods; t++) {
                builder.addForecast(DemandForecast.normal("P1", locationId, t, 15.0 + l + t, 3.0));
                builder.addForecast(DemandForecast.normal("P2", locationId, t, 25.0 - t, 5.0));
            }
        }
        return builder.build();
    }

    private static CycleContext cycle(final String cycleId, final PlanningSnapshot snapshot, final Horizon horizon,
                                      final List<Partition> partitions) {
        return new CycleContext(cycleId, horizon, snapshot, partitions);
    }

    @Test
    public void testSolvedPartition() throws Exception {
        final OptimizerConfig config = Fixtures.config();
        final PolicyStore store = new PolicyStore();
        final RollingHorizonController controller = new RollingHorizonController(config, new OrToolsSolver(config),
                new ReorderPointHeuristic(), store);

        final BatchReport report = controller.runCycle(cycle("cycle-0", Fixtures.singlePeriod(1000.0),
                Fixtures.horizon(1), List.of(Fixtures.single())));
        final PartitionOutcome outcome = report.outcome("part-1");
        assertEquals(Resolution.SOLVED, outcome.resolution());
        assertEquals(SolverStatus.OPTIMAL, outcome.nominalStatus());
        assertEquals(List.of(PartitionState.BUILDING, PartitionState.SOLVING, PartitionState.EXTRACTING,
                PartitionState.PERSISTED), outcome.history());
        assertEquals(100.0, outcome.policies().get(0).orderQuantity(), 1e-6);
        assertEquals(0, report.failedCount());

        final List<Policy> stored = store.policiesForCycle("cycle-0");
        assertEquals(1, stored.size());
        assertEquals(100.0, stored.get(0).orderQuantity(), 1e-6);
        assertEquals("cycle-0", store.lastKnownGoodCycle("part-1"));
        assert !store.isResolveRequested("part-1");
    }

    @Test
    public void testInfeasiblePartitionIsRepaired() throws Exception {
        final OptimizerConfig config = Fixtures.config();
        final PolicyStore store = new PolicyStore();
        final RollingHorizonController controller = new RollingHorizonController(config, new OrToolsSolver(config),
                new ReorderPointHeuristic(), store);

        final BatchReport report = controller.runCycle(cycle("cycle-0", Fixtures.singlePeriod(50.0),
                Fixtures.horizon(1), List.of(Fixtures.single())));
        final PartitionOutcome outcome = report.outcome("part-1");
        assertEquals(Resolution.RELAXED_BACKLOG, outcome.resolution());
        assertEquals(SolverStatus.INFEASIBLE, outcome.nominalStatus());
        assertTrue(outcome.history().contains(PartitionState.REPAIRING));
        assertEquals(PartitionState.PERSISTED, outcome.state());
        assertTrue(outcome.audit().realizedShortageUnits() > 0.0);

        for (final Policy policy : store.policiesForCycle("cycle-0")) {
            assertEquals(SolverStatus.INFEASIBLE, policy.solverStatus());
            assertNotEquals(SolverStatus.OPTIMAL, policy.solverStatus());
            assertEquals(Resolution.RELAXED_BACKLOG, policy.resolution());
            assertEquals(50.0, policy.orderQuantity(), 1e-6);
        }
        assertEquals("cycle-0", store.lastKnownGoodCycle("part-1"));
    }

    /**
     * One period of deterministic demand at a location that receives 97 units at most.
     */
    private static PlanningSnapshot tightReceiving(final double demand) {
        return PlanningSnapshot.builder()
                .addProduct(new Product(Fixtures.PRODUCT, 1.0, 100.0, 50.0, 0.0, 0))
                .addLocation(new Location(Fixtures.LOCATION, 97.0, 0.95))
                .addForecast(DemandForecast.normal(Fixtures.PRODUCT, Fixtures.LOCATION, 0, demand, 0.0))
                .build();
    }

    private static void assertRoundedDown(final PolicyStore store, final PartitionOutcome outcome,
                                          final double shortage) {
        assertEquals(Resolution.RELAXED_BACKLOG, outcome.resolution());
        assertEquals(SolverStatus.FEASIBLE_SUBOPTIMAL, outcome.nominalStatus());
        assertEquals(PartitionState.PERSISTED, outcome.state());
        assertEquals(shortage, outcome.audit().realizedShortageUnits(), 1e-6);

        final List<Policy> stored = store.policiesForCycle("cycle-0");
        assertEquals(1, stored.size());
        assertEquals(90.0, stored.get(0).orderQuantity(), 1e-9);
        assertEquals(Resolution.RELAXED_BACKLOG, stored.get(0).resolution());
        assertNotEquals(SolverStatus.OPTIMAL, stored.get(0).solverStatus());
        assertEquals("cycle-0", store.lastKnownGoodCycle("part-1"));
    }

    @Test
    public void testRoundingOverCapacityIsRepaired() throws Exception {
        final OptimizerConfig config = new OptimizerConfig.Builder().setOrderGranularity(10.0).build();
        final PolicyStore store = new PolicyStore();
        final ReorderPointHeuristic heuristic = new ReorderPointHeuristic();
        final RollingHorizonController controller = new RollingHorizonController(config, heuristic, heuristic,
                store);

        final BatchReport report = controller.runCycle(cycle("cycle-0", tightReceiving(95.0), Fixtures.horizon(1),
                List.of(Fixtures.single())));
        assertEquals(0, report.failedCount());
        assertRoundedDown(store, report.outcome("part-1"), 5.0);
    }

    @Test
    public void testRoundingOverCapacityIsRepairedAfterSolve() throws Exception {
        final OptimizerConfig config = new OptimizerConfig.Builder()
                .setOrderGranularity(10.0)
                .setTimeLimitMillis(20_000)
                .build();
        final PolicyStore store = new PolicyStore();
        final RollingHorizonController controller = new RollingHorizonController(config, new OrToolsSolver(config),
                new ReorderPointHeuristic(), store);

        final BatchReport report = controller.runCycle(cycle("cycle-0", tightReceiving(96.0), Fixtures.horizon(1),
                List.of(Fixtures.single())));
        final PartitionOutcome outcome = report.outcome("part-1");
        assertTrue(outcome.history().contains(PartitionState.REPAIRING));
        assertRoundedDown(store, outcome, 6.0);
    }

    @Test
    public void testUnrepairablePartitionFails() throws Exception {
        final OptimizerConfig config = Fixtures.config();
        final PolicyStore store = new PolicyStore();
        final ReorderPointHeuristic heuristic = new ReorderPointHeuristic();
        final RollingHorizonController controller = new RollingHorizonController(config, heuristic, heuristic,
                store);

        final PartialBatchFailureException e = assertThrows(PartialBatchFailureException.class,
                () -> controller.runCycle(cycle("cycle-0", Fixtures.singlePeriod(-10.0), Fixtures.horizon(1),
                        List.of(Fixtures.single()))));
        final PartitionOutcome outcome = e.report().outcome("part-1");
        assertTrue(outcome.isFailed());
        assertEquals(PartitionState.FAILED, outcome.state());
        assertEquals(SolverStatus.INFEASIBLE, outcome.nominalStatus());
        assertEquals(1.0, e.report().failedFraction(), 1e-12);

        final List<Policy> stored = store.policiesForCycle("cycle-0");
        assertEquals(1, stored.size());
        assertEquals(0.0, stored.get(0).orderQuantity(), 1e-12);
        assertEquals(Resolution.FAILED, stored.get(0).resolution());
        assertNull(store.lastKnownGoodCycle("part-1"));
    }

    @Test
    public void testValidationFailureStaysInItsPartition() throws Exception {
        final OptimizerConfig config = new OptimizerConfig.Builder()
                .setWorkers(2)
                .setPartialFailureThreshold(0.6)
                .build();
        final PlanningSnapshot snapshot = network(1, 2).toBuilder()
                .addProduct(new Product("P9", -1.0, 10.0, 20.0, 0.0, 0))
                .addLocation(new Location("L9", 500.0, 0.9))
                .addForecast(DemandForecast.normal("P9", "L9", 0, 10.0, 2.0))
                .addForecast(DemandForecast.normal("P9", "L9", 1, 10.0, 2.0))
                .build();
        final List<Partition> partitions = List.of(
                Fixtures.partition("good", List.of("P1", "P2"), List.of("L1")),
                Fixtures.partition("bad", List.of("P9"), List.of("L9")));
        final ReorderPointHeuristic heuristic = new ReorderPointHeuristic();
        final RollingHorizonController controller = new RollingHorizonController(config, heuristic, heuristic,
                new PolicyStore());

        final BatchReport report = controller.runCycle(cycle("cycle-0", snapshot, new Horizon(0, 2), partitions));
        assertEquals(Resolution.SOLVED, report.outcome("good").resolution());
        assertEquals(4, report.outcome("good").policies().size());

        final PartitionOutcome bad = report.outcome("bad");
        assertTrue(bad.isFailed());
        assertEquals(SolverStatus.ERROR, bad.nominalStatus());
        assertTrue(bad.error().contains("P9"));
        assertEquals(List.of(PartitionState.BUILDING, PartitionState.FAILED), bad.history());
        assertEquals(2, bad.policies().size());
        assertEquals(0.5, report.failedFraction(), 1e-12);
    }

    @Test
    public void testTimeoutFallsBack() throws Exception {
        final OptimizerConfig config = new OptimizerConfig.Builder()
                .setTimeLimitMillis(1000)
                .setResolveTimeLimitMultiplier(3.0)
                .setWorkers(1)
                .build();
        final PolicyStore store = new PolicyStore();
        final TimingOutSolver solver = new TimingOutSolver();
        final RollingHorizonController controller = new RollingHorizonController(config, solver,
                new ReorderPointHeuristic(), store);
        final PlanningSnapshot snapshot = network(1, 4);
        final List<Partition> partitions = List.of(Fixtures.partition("part-1", List.of("P1", "P2"),
                List.of("L1")));

        // No prior policies, so the heuristic plans the first cycle
        final BatchReport first = controller.runCycle(cycle("cycle-0", snapshot, new Horizon(0, 3), partitions));
        final PartitionOutcome heuristic = first.outcome("part-1");
        assertEquals(Resolution.HEURISTIC, heuristic.resolution());
        assertEquals(SolverStatus.TIMED_OUT, heuristic.nominalStatus());
        assertTrue(heuristic.resolveRequested());
        assertEquals(1000, solver.lastTimeLimit.get());
        for (final Policy policy : heuristic.policies()) {
            assertEquals(SolverStatus.TIMED_OUT, policy.solverStatus());
        }
        assertTrue(store.isResolveRequested("part-1"));
        assertEquals("cycle-0", store.lastKnownGoodCycle("part-1"));

        // The second cycle gets a longer limit and reuses the first one's policies
        final BatchReport second = controller.runCycle(cycle("cycle-1", snapshot, new Horizon(1, 3), partitions));
        assertEquals(3000, solver.lastTimeLimit.get());
        final PartitionOutcome prior = second.outcome("part-1");
        assertEquals(Resolution.PRIOR_CYCLE, prior.resolution());
        assertEquals(6, prior.policies().size());
        for (final Policy policy : prior.policies()) {
            assertEquals(SolverStatus.TIMED_OUT, policy.solverStatus());
            assertEquals(Resolution.PRIOR_CYCLE, policy.resolution());
            assertTrue(policy.period() >= 1 && policy.period() <= 3);
        }
        // Period 3 was never planned, so it keeps the last known targets without ordering
        for (final Policy policy : prior.policies()) {
            if (policy.period() == 3) {
                assertEquals(0.0, policy.orderQuantity(), 1e-12);
            }
        }
        assertEquals("cycle-0", store.lastKnownGoodCycle("part-1"));
        assertTrue(store.isResolveRequested("part-1"));
    }

    @Test
    public void testOutcomesInPartitionOrder() throws Exception {
        final OptimizerConfig config = new OptimizerConfig.Builder().setWorkers(3).build();
        final PlanningSnapshot snapshot = network(5, 3);
        final Horizon horizon = new Horizon(0, 3);
        final List<Partition> partitions = Partitioner.byLocation(snapshot, horizon, 2);
        assertEquals(5, partitions.size());

        final ReorderPointHeuristic heuristic = new ReorderPointHeuristic();
        final PolicyStore store = new PolicyStore();
        final BatchReport report = new RollingHorizonController(config, heuristic, heuristic, store)
                .runCycle(cycle("cycle-0", snapshot, horizon, partitions));

        final List<String> ids = new ArrayList<>();
        for (final PartitionOutcome outcome : report.outcomes()) {
            ids.add(outcome.partitionId());
            assertEquals(PartitionState.PERSISTED, outcome.state());
        }
        assertEquals(List.of("partition-1", "partition-2", "partition-3", "partition-4", "partition-5"), ids);
        assertEquals(30, store.policiesForCycle("cycle-0").size());
        assertEquals(5, report.resolutionCounts().get(Resolution.SOLVED));
    }

    @Test
    public void testDeterministic() throws Exception {
        final OptimizerConfig config = Fixtures.config();
        final PlanningSnapshot snapshot = network(3, 4);
        final Horizon horizon = new Horizon(0, 4);
        final List<Partition> partitions = Partitioner.byLocation(snapshot, horizon, 2);

        final List<Policy> first = new RollingHorizonController(config, new OrToolsSolver(config),
                new ReorderPointHeuristic(), new PolicyStore())
                .runCycle(cycle("cycle-0", snapshot, horizon, partitions)).policies();
        final List<Policy> second = new RollingHorizonController(config, new OrToolsSolver(config),
                new ReorderPointHeuristic(), new PolicyStore())
                .runCycle(cycle("cycle-0", snapshot, horizon, partitions)).policies();
        assertEquals(first, second);
    }
}
