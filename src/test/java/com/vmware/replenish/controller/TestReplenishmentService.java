package com.vmware.replenish.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.vmware.replenish.Fixtures;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Resolution;
import com.vmware.replenish.model.SolverStatus;
import com.vmware.replenish.optimizer.OptimizerConfig;
import com.vmware.replenish.optimizer.OrToolsSolver;
import com.vmware.replenish.optimizer.ReorderPointHeuristic;
import com.vmware.replenish.optimizer.ValidationException;

public class TestReplenishmentService {

    @Test
    public void testWhatIf() throws ValidationException {
        final OptimizerConfig config = Fixtures.config();
        final ReplenishmentService service = new ReplenishmentService(config, new OrToolsSolver(config),
                Fixtures.singlePeriod(1000.0));

        final List<Policy> policies = service.solvePartition(List.of(Fixtures.PRODUCT), List.of(Fixtures.LOCATION),
                Fixtures.horizon(1));
        assertEquals(1, policies.size());
        assertEquals(100.0, policies.get(0).orderQuantity(), 1e-6);
        assertEquals(SolverStatus.OPTIMAL, policies.get(0).solverStatus());
        assertEquals(Resolution.SOLVED, policies.get(0).resolution());
    }

    @Test
    public void testRawStatusWithoutRepair() throws ValidationException {
        final ReplenishmentService service = new ReplenishmentService(Fixtures.config(),
                new ReorderPointHeuristic(), Fixtures.multiPeriod(3, 10.0, 0.0, 0, -5.0));

        final List<Policy> policies = service.solvePartition(List.of(Fixtures.PRODUCT), List.of(Fixtures.LOCATION),
                Fixtures.horizon(3));
        assertEquals(3, policies.size());
        for (final Policy policy : policies) {
            assertEquals(0.0, policy.orderQuantity(), 1e-12);
            assertEquals(SolverStatus.INFEASIBLE, policy.solverStatus());
            assertEquals(Resolution.FAILED, policy.resolution());
        }
    }

    @Test
    public void testUnknownIds() {
        final ReplenishmentService service = new ReplenishmentService(Fixtures.config(),
                new ReorderPointHeuristic(), Fixtures.singlePeriod(1000.0));
        assertThrows(ValidationException.class, () -> service.solvePartition(List.of("P404"),
                List.of(Fixtures.LOCATION), Fixtures.horizon(1)));
        assertThrows(ValidationException.class, () -> service.solvePartition(List.of(Fixtures.PRODUCT),
                List.of("L404"), Fixtures.horizon(1)));
    }
}
