package com.vmware.replenish.optimizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.vmware.replenish.Fixtures;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.model.Resolution;
import com.vmware.replenish.model.SolverStatus;

public class TestPolicyExtractor {

    private static OptimizerConfig granular(final double granularity) {
        return new OptimizerConfig.Builder()
                .setOrderGranularity(granularity)
                .setDecimalPrecision(2)
                .build();
    }

    private static double[] plan(final OptimizationProblem problem, final double order, final double shortage,
                                 final double reorderPoint) {
        final ItemModel item = problem.items().get(0);
        final double[] values = new double[problem.numVariables()];
        values[item.orderQty(0).index()] = order;
        values[item.orderPlaced(0).index()] = order > 0.0 ? 1.0 : 0.0;
        values[item.shortage(0).index()] = shortage;
        values[item.reorderPoint(0).index()] = reorderPoint;
        return values;
    }

    @Test
    public void testRoundOrder() {
        final PolicyExtractor extractor = new PolicyExtractor(granular(10.0));
        assertEquals(30.0, extractor.roundOrder(12.0, 25.0), 1e-12);
        assertEquals(40.0, extractor.roundOrder(44.0, 25.0), 1e-12);
        assertEquals(0.0, extractor.roundOrder(1e-7, 25.0), 1e-12);
        assertEquals(0.0, extractor.roundOrder(4.0, 0.0), 1e-12);
        assertEquals(10.0, extractor.roundOrder(5.0, 0.0), 1e-12);
    }

    @Test
    public void testRoundHalfUp() {
        final PolicyExtractor extractor = new PolicyExtractor(granular(1.0));
        assertEquals(1.01, extractor.round(1.005), 1e-12);
        assertEquals(2.0, extractor.round(1.999), 1e-12);
        assertEquals(0.0, extractor.round(-0.3), 1e-12);
        assertEquals(0.0, extractor.round(-0.001), 1e-12);
    }

    @Test
    public void testExtractSolvedPlan() throws ReplenishmentException {
        final OptimizerConfig config = granular(10.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.singlePeriod(1000.0), Fixtures.horizon(1), Relaxation.NOMINAL);
        final Solution solution = Solution.accepted(SolverStatus.OPTIMAL, 50.0, 50.0, 0.0, 1,
                plan(problem, 100.0, 0.0, 100.0));

        final PolicyExtractor.ExtractionResult result = new PolicyExtractor(config).extract(problem, solution);
        assertEquals(1, result.policies().size());
        final Policy policy = result.policies().get(0);
        assertEquals(Fixtures.PRODUCT, policy.productId());
        assertEquals(Fixtures.LOCATION, policy.locationId());
        assertEquals(0, policy.period());
        assertEquals(100.0, policy.orderQuantity(), 1e-12);
        assertEquals(0.0, policy.safetyStock(), 1e-12);
        assertEquals(100.0, policy.reorderPoint(), 1e-12);
        assertEquals(50.0, policy.objectiveValue(), 1e-12);
        assertEquals(SolverStatus.OPTIMAL, policy.solverStatus());
        assertEquals(Resolution.SOLVED, policy.resolution());
        assertEquals(50.0, result.realizedTotalCost(), 1e-12);
    }

    @Test
    public void testRealizedCostsUnderLostSales() throws ReplenishmentException {
        final OptimizerConfig config = granular(1.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.singlePeriod(1000.0), Fixtures.horizon(1), Relaxation.backlog());
        final Solution solution = Solution.accepted(SolverStatus.FEASIBLE_SUBOPTIMAL, 250.0, Double.NaN, Double.NaN,
                1, plan(problem, 80.0, 20.0, 100.0));

        final PolicyExtractor.ExtractionResult result = new PolicyExtractor(config).extract(problem, solution);
        assertEquals(0.0, result.realizedHoldingCost(), 1e-12);
        assertEquals(20.0, result.realizedShortageUnits(), 1e-12);
        assertEquals(200.0, result.realizedShortageCost(), 1e-12);
        assertEquals(50.0, result.realizedOrderingCost(), 1e-12);
        assertEquals(250.0, result.realizedTotalCost(), 1e-12);
        assertEquals(SolverStatus.FEASIBLE_SUBOPTIMAL, result.policies().get(0).solverStatus());
    }

    @Test
    public void testRoundingBreaksCapacity() throws ValidationException {
        final OptimizerConfig config = granular(10.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.singlePeriod(96.0), Fixtures.horizon(1), Relaxation.NOMINAL);
        final Solution solution = Solution.accepted(SolverStatus.OPTIMAL, 90.0, 90.0, 0.0, 1,
                plan(problem, 95.0, 5.0, 100.0));
        assertThrows(PolicyRoundingException.class, () -> new PolicyExtractor(config).extract(problem, solution));
    }

    @Test
    public void testRoundDownUnderBacklog() throws ReplenishmentException {
        final OptimizerConfig config = granular(10.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.singlePeriod(96.0), Fixtures.horizon(1), Relaxation.backlog());
        final Solution solution = Solution.accepted(SolverStatus.OPTIMAL, 90.0, 90.0, 0.0, 1,
                plan(problem, 95.0, 5.0, 100.0));

        final PolicyExtractor.ExtractionResult result = new PolicyExtractor(config).extract(problem, solution);
        assertEquals(90.0, result.policies().get(0).orderQuantity(), 1e-12);
        assertEquals(10.0, result.realizedShortageUnits(), 1e-12);
        assertEquals(100.0, result.realizedShortageCost(), 1e-12);
    }

    @Test
    public void testRoundDownBelowMinimumOrderQuantity() throws ReplenishmentException {
        final OptimizerConfig config = granular(10.0);
        final PlanningSnapshot snapshot = Fixtures.singlePeriod(1000.0).toBuilder()
                .addProduct(new Product(Fixtures.PRODUCT, 1.0, 10.0, 50.0, 100.0, 0))
                .addLocation(new Location(Fixtures.LOCATION, 95.0, 0.95))
                .build();
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(), snapshot,
                Fixtures.horizon(1), Relaxation.backlog());
        final Solution solution = Solution.accepted(SolverStatus.OPTIMAL, 100.0, 100.0, 0.0, 1,
                plan(problem, 100.0, 0.0, 100.0));

        final PolicyExtractor.ExtractionResult result = new PolicyExtractor(config).extract(problem, solution);
        assertEquals(0.0, result.policies().get(0).orderQuantity(), 1e-12);
        assertEquals(100.0, result.realizedShortageUnits(), 1e-12);
        assertEquals(0.0, result.realizedOrderingCost(), 1e-12);
    }

    @Test
    public void testOrderThatCannotArrive() throws ValidationException {
        final OptimizerConfig config = granular(1.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.multiPeriod(3, 10.0, 0.0, 2, 1000.0), Fixtures.horizon(3), Relaxation.backlog());
        final ItemModel item = problem.items().get(0);
        final double[] values = new double[problem.numVariables()];
        values[item.orderQty(1).index()] = 20.0;
        values[item.orderPlaced(1).index()] = 1.0;
        final Solution solution = Solution.accepted(SolverStatus.OPTIMAL, 0.0, 0.0, 0.0, 1, values);
        assertThrows(PolicyRoundingException.class, () -> new PolicyExtractor(config).extract(problem, solution));
    }

    @Test
    public void testRejectedStatuses() throws ValidationException {
        final OptimizerConfig config = granular(1.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.singlePeriod(1000.0), Fixtures.horizon(1), Relaxation.NOMINAL);
        final PolicyExtractor extractor = new PolicyExtractor(config);

        assertThrows(InfeasibleModelException.class, () -> extractor.extract(problem,
                Solution.rejected(SolverStatus.INFEASIBLE, "infeasible", 1)));
        assertThrows(SolverTimeoutException.class, () -> extractor.extract(problem,
                Solution.rejected(SolverStatus.TIMED_OUT, "no incumbent", 1)));
        assertThrows(SolverException.class, () -> extractor.extract(problem,
                Solution.rejected(SolverStatus.ERROR, "crashed", 1)));
    }

    @Test
    public void testPolicyOrder() throws ReplenishmentException {
        final OptimizerConfig config = granular(1.0);
        final OptimizationProblem problem = new ProblemBuilder(config).build(Fixtures.single(),
                Fixtures.multiPeriod(4, 10.0, 0.0, 0, 1000.0), Fixtures.horizon(4), Relaxation.backlog());
        final Solution solution = Solution.accepted(SolverStatus.OPTIMAL, 0.0, 0.0, 0.0, 1,
                new double[problem.numVariables()]);
        final List<Policy> policies = new PolicyExtractor(config).extract(problem, solution).policies();
        assertEquals(4, policies.size());
        for (int t = 0; t < 4; t++) {
            assertEquals(t, policies.get(t).period());
            assertEquals(0.0, policies.get(t).orderQuantity(), 1e-12);
        }
    }
}
