package com.vmware.replenish.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.vmware.replenish.controller.BatchReport;
import com.vmware.replenish.controller.RollingHorizonController;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.PeriodKey;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.ReorderPointHeuristic;
import com.vmware.replenish.store.PolicyStore;

public class TestSimulation {
    private static final int NUM_PRODUCTS = 3;
    private static final int NUM_LOCATIONS = 2;
    private static final int HORIZON = 4;
    private static final int CYCLES = 5;

    private static Simulation simulation(final PolicyStore store, final Integer seed) {
        final OptimizerConfig config = new OptimizerConfig.Builder().setWorkers(2).build();
        final ReorderPointHeuristic heuristic = new ReorderPointHeuristic();
        final RollingHorizonController controller = new RollingHorizonController(config, heuristic, heuristic,
                store);
        return new Simulation(controller, config, seed, NUM_PRODUCTS, NUM_LOCATIONS, HORIZON, CYCLES, 3);
    }

    @Test
    public void testSimulationInstantiation() {
        final Simulation sim = simulation(new PolicyStore(), 42);

        assertEquals(NUM_PRODUCTS, sim.snapshot().products().size());
        assertEquals(NUM_LOCATIONS, sim.snapshot().locations().size());
        assertEquals(NUM_PRODUCTS * NUM_LOCATIONS * (HORIZON + CYCLES), sim.snapshot().forecasts().size());
        assertEquals(new Horizon(0, HORIZON), sim.horizon());
        assertNotNull(sim.snapshot().product("P001"));
        assertNotNull(sim.snapshot().location("L02"));
        assertNotNull(sim.snapshot().forecast(new PeriodKey("P003", "L01", HORIZON + CYCLES - 1)));
        assertEquals(0, sim.summary().cycles());
    }

    @Test
    public void testStep() throws InterruptedException {
        final PolicyStore store = new PolicyStore();
        final Simulation sim = simulation(store, 42);

        final BatchReport report = sim.step();
        assertEquals("cycle-0", report.cycleId());
        // Three items per location and three per partition
        assertEquals(NUM_LOCATIONS, report.outcomes().size());
        assertEquals(NUM_PRODUCTS * NUM_LOCATIONS * HORIZON, report.policies().size());
        assertEquals(report.policies().size(), store.policiesForCycle("cycle-0").size());

        assertEquals(new Horizon(1, HORIZON), sim.horizon());
        assertEquals(1, sim.summary().cycles());
        for (int p = 0; p < NUM_PRODUCTS; p++) {
            assert sim.snapshot().inventory(new ItemKey(Simulation.productId(p), "L01")).onHand() >= 0.0;
        }
    }

    @Test
    public void testRun() throws InterruptedException {
        final SimulationSummary summary = simulation(new PolicyStore(), 7).run(CYCLES);

        assertEquals(CYCLES, summary.cycles());
        assertEquals(0, summary.failedCycles());
        assertTrue(summary.demand() > 0.0);
        assertTrue(summary.lostSales() >= 0.0 && summary.lostSales() <= summary.demand());
        assertTrue(summary.fillRate() >= 0.0 && summary.fillRate() <= 1.0);
        assertEquals(summary.holdingCost() + summary.shortageCost() + summary.orderingCost(), summary.totalCost(),
                1e-9);

        int partitions = 0;
        for (final int count : summary.resolutions().values()) {
            partitions += count;
        }
        assertEquals(CYCLES * NUM_LOCATIONS, partitions);
    }

    @Test
    public void testSeededRunsAgree() throws InterruptedException {
        final SimulationSummary first = simulation(new PolicyStore(), 11).run(CYCLES);
        final SimulationSummary second = simulation(new PolicyStore(), 11).run(CYCLES);

        assertEquals(first.demand(), second.demand(), 1e-9);
        assertEquals(first.lostSales(), second.lostSales(), 1e-9);
        assertEquals(first.ordered(), second.ordered(), 1e-9);
        assertEquals(first.totalCost(), second.totalCost(), 1e-9);
        assertEquals(first.resolutions(), second.resolutions());
    }
}
