/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;

import com.vmware.replenish.model.SolverStatus;

/**
 * {@link Solver} over the OR-tools linear solver wrapper. The primary cost objective is solved
 * first; when that yields a usable plan the secondary objective is minimized with the cost
 * held at the value found. The backend runs single threaded with a fixed seed, and each stage
 * gets a fixed share of the time limit.
 */
public class OrToolsSolver implements Solver {
    private static final Logger LOG = LogManager.getLogger(OrToolsSolver.class);

    /** Slack granted to the backend past its own time limit before it is interrupted. */
    static final long GRACE_MILLIS = 1_000;

    /** Absolute slack on the primary cost while breaking ties. */
    static final double TIE_EPSILON = 1e-6;

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread thread = new Thread(r, "solver-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    private static Boolean nativeLoaded = null;

    private final OptimizerConfig config;

    public OrToolsSolver(final OptimizerConfig config) {
        this.config = config;
    }

    private static synchronized boolean loadNative() {
        if (nativeLoaded == null) {
            try {
                Loader.loadNativeLibraries();
                nativeLoaded = true;
            } catch (final UnsatisfiedLinkError | RuntimeException e) {
                LOG.error("Failed to load OR-tools native libraries", e);
                nativeLoaded = false;
            }
        }
        return nativeLoaded;
    }

    @Override
    public String name() {
        return "ortools-" + config.backend();
    }

    @Override
    public Solution solve(final OptimizationProblem problem, final long timeLimitMillis, final double gapTolerance) {
        final long start = System.nanoTime();
        if (!loadNative()) {
            return Solution.rejected(SolverStatus.ERROR, "OR-tools native libraries unavailable", 0);
        }

        final MPSolver solver;
        try {
            solver = MPSolver.createSolver(config.backend());
        } catch (final RuntimeException e) {
            return Solution.rejected(SolverStatus.ERROR, "Backend " + config.backend() + " failed: " + e.getMessage(),
                    elapsed(start));
        }
        if (solver == null) {
            return Solution.rejected(SolverStatus.ERROR, "Backend " + config.backend() + " is not available",
                    elapsed(start));
        }

        final Interrupter interrupter = new Interrupter(solver);
        final ScheduledFuture<?> watchdog = WATCHDOG.schedule(interrupter::interrupt,
                timeLimitMillis + GRACE_MILLIS, TimeUnit.MILLISECONDS);
        final MPSolverParameters params = new MPSolverParameters();
        try {
            return solve(solver, params, problem, timeLimitMillis, gapTolerance, start);
        } catch (final RuntimeException e) {
            LOG.error("Solver backend failed on partition {}", problem.partition().partitionId(), e);
            return Solution.rejected(SolverStatus.ERROR, "Backend exception: " + e.getMessage(), elapsed(start));
        } finally {
            watchdog.cancel(false);
            interrupter.close();
            params.delete();
            solver.delete();
        }
    }

    private Solution solve(final MPSolver solver, final MPSolverParameters params, final OptimizationProblem problem,
                           final long timeLimitMillis, final double gapTolerance, final long start) {
        solver.setNumThreads(1);
        if ("SCIP".equalsIgnoreCase(config.backend())) {
            solver.setSolverSpecificParametersAsString("randomization/randomseedshift = " + config.randomSeed());
        }
        params.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, gapTolerance);

        final List<Variable> variables = problem.variables();
        final MPVariable[] vars = new MPVariable[variables.size()];
        for (final Variable variable : variables) {
            vars[variable.index()] = solver.makeVar(bound(variable.lowerBound()), bound(variable.upperBound()),
                    variable.integer(), variable.name());
        }
        for (final LinearConstraint constraint : problem.constraints()) {
            final MPConstraint row = solver.makeConstraint(bound(constraint.lowerBound()),
                    bound(constraint.upperBound()), constraint.name());
            for (final Map.Entry<Integer, Double> term : constraint.expression().terms().entrySet()) {
                row.setCoefficient(vars[term.getKey()], term.getValue());
            }
        }
        final MPObjective objective = solver.objective();
        setObjective(objective, vars, problem.primaryObjective());

        final long secondaryLimit = problem.secondaryObjective().isEmpty()
                ? 0
                : (long) (timeLimitMillis * config.tieBreakTimeShare());
        final long primaryLimit = timeLimitMillis - secondaryLimit;
        solver.setTimeLimit(primaryLimit);
        final MPSolver.ResultStatus primaryStatus = solver.solve(params);
        final long afterPrimary = elapsed(start);

        final SolverStatus status;
        double gap = 0.0;
        double bestBound = Double.NaN;
        switch (primaryStatus) {
            case OPTIMAL:
                status = SolverStatus.OPTIMAL;
                bestBound = objective.bestBound();
                break;
            case FEASIBLE:
                bestBound = objective.bestBound();
                gap = relativeGap(objective.value(), bestBound);
                status = gap <= gapTolerance ? SolverStatus.FEASIBLE_SUBOPTIMAL : SolverStatus.TIMED_OUT;
                break;
            case INFEASIBLE:
                return Solution.rejected(SolverStatus.INFEASIBLE, "Model is infeasible", afterPrimary);
            case NOT_SOLVED:
                if (afterPrimary >= primaryLimit) {
                    return Solution.rejected(SolverStatus.TIMED_OUT,
                            "No solution within " + primaryLimit + "ms", afterPrimary);
                }
                return Solution.rejected(SolverStatus.ERROR, "Backend did not solve the model", afterPrimary);
            default:
                return Solution.rejected(SolverStatus.ERROR, "Backend returned " + primaryStatus, afterPrimary);
        }
        if (status == SolverStatus.TIMED_OUT) {
            return Solution.rejected(SolverStatus.TIMED_OUT,
                    String.format("Gap %.6f above tolerance at the deadline", gap), afterPrimary);
        }

        final double primaryValue = objective.value();
        double[] values = read(vars);

        if (secondaryLimit > 0) {
            // Ties only: the cost may not rise above the plan already found
            final MPConstraint costBound = solver.makeConstraint(-MPSolver.infinity(), primaryValue + TIE_EPSILON,
                    "primary_objective_bound");
            for (final Map.Entry<Integer, Double> term : problem.primaryObjective().terms().entrySet()) {
                costBound.setCoefficient(vars[term.getKey()], term.getValue());
            }
            objective.clear();
            setObjective(objective, vars, problem.secondaryObjective());
            solver.setTimeLimit(secondaryLimit);
            final MPSolver.ResultStatus secondaryStatus = solver.solve(params);
            final boolean solved = secondaryStatus == MPSolver.ResultStatus.OPTIMAL
                    || secondaryStatus == MPSolver.ResultStatus.FEASIBLE;
            final double[] tieBroken = solved ? read(vars) : null;
            if (tieBroken != null
                    && problem.primaryObjective().evaluate(tieBroken) <= problem.primaryObjective().evaluate(values)
                    + TIE_EPSILON) {
                values = tieBroken;
            } else {
                LOG.debug("Tie-break solve on partition {} returned {}, keeping cost optimal plan",
                        problem.partition().partitionId(), secondaryStatus);
            }
        }

        final long wallTime = elapsed(start);
        LOG.debug("Partition {} solved: status={}, objective={}, bound={}, wallTime={}ms",
                problem.partition().partitionId(), status, primaryValue, bestBound, wallTime);
        return Solution.accepted(status, problem.primaryObjective().evaluate(values), bestBound, gap, wallTime,
                values);
    }

    private static void setObjective(final MPObjective objective, final MPVariable[] vars,
                                     final LinearExpression expression) {
        for (final Map.Entry<Integer, Double> term : expression.terms().entrySet()) {
            objective.setCoefficient(vars[term.getKey()], term.getValue());
        }
        objective.setMinimization();
    }

    private static double[] read(final MPVariable[] vars) {
        final double[] values = new double[vars.length];
        for (int i = 0; i < vars.length; i++) {
            values[i] = vars[i].solutionValue();
        }
        return values;
    }

    private static double bound(final double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return -MPSolver.infinity();
        }
        return value;
    }

    static double relativeGap(final double objective, final double bound) {
        if (Double.isNaN(bound)) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(objective - bound) / Math.max(Math.abs(objective), 1e-9);
    }

    private static long elapsed(final long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    /**
     * Lets the watchdog interrupt a running backend without racing its deletion.
     */
    private static final class Interrupter {
        private final MPSolver solver;
        private boolean closed = false;

        Interrupter(final MPSolver solver) {
            this.solver = solver;
        }

        synchronized void interrupt() {
            if (!closed) {
                LOG.warn("Solver exceeded its time limit by {}ms, interrupting", GRACE_MILLIS);
                solver.interruptSolve();
            }
        }

        synchronized void close() {
            closed = true;
        }
    }
}
