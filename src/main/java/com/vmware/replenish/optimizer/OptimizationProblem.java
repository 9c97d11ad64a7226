/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;

/**
 * The mixed-integer model of one partition for one solve. Variables and constraints are
 * kept in creation order so any backend receives an identical model for identical input.
 * A problem belongs to a single worker and is discarded after its solution is extracted.
 */
public final class OptimizationProblem {
    private final Partition partition;
    private final Horizon horizon;
    private final Relaxation relaxation;
    private final List<ItemModel> items = new ArrayList<>();
    private final Map<String, Location> locations = new LinkedHashMap<>();
    private final List<Variable> variables = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private final LinearExpression primaryObjective = new LinearExpression();
    private final LinearExpression secondaryObjective = new LinearExpression();

    OptimizationProblem(final Partition partition, final Horizon horizon, final Relaxation relaxation) {
        this.partition = partition;
        this.horizon = horizon;
        this.relaxation = relaxation;
    }

    Variable newVariable(final String name, final double lowerBound, final double upperBound,
                         final boolean integer) {
        final Variable variable = new Variable(variables.size(), name, lowerBound, upperBound, integer);
        variables.add(variable);
        return variable;
    }

    void addConstraint(final LinearConstraint constraint) {
        constraints.add(constraint);
    }

    void addItem(final ItemModel item) {
        items.add(item);
        locations.putIfAbsent(item.location().locationId(), item.location());
    }

    public Partition partition() {
        return partition;
    }

    public Horizon horizon() {
        return horizon;
    }

    public Relaxation relaxation() {
        return relaxation;
    }

    public List<ItemModel> items() {
        return Collections.unmodifiableList(items);
    }

    /**
     * @return the locations of the items, in first-seen order
     */
    public List<Location> locations() {
        return List.copyOf(locations.values());
    }

    public List<ItemModel> itemsAt(final String locationId) {
        final List<ItemModel> atLocation = new ArrayList<>();
        for (final ItemModel item : items) {
            if (item.location().locationId().equals(locationId)) {
                atLocation.add(item);
            }
        }
        return atLocation;
    }

    public List<Variable> variables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LinearConstraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Total holding, shortage and ordering cost.
     */
    public LinearExpression primaryObjective() {
        return primaryObjective;
    }

    /**
     * Tie-break objective, minimized among optima of the primary objective.
     */
    public LinearExpression secondaryObjective() {
        return secondaryObjective;
    }

    public int numVariables() {
        return variables.size();
    }

    public int numConstraints() {
        return constraints.size();
    }

    /**
     * @return the first constraint violated by more than the tolerance, or null
     */
    public LinearConstraint firstViolated(final double[] values, final double tolerance) {
        for (final Variable variable : variables) {
            final double value = values[variable.index()];
            if (value < variable.lowerBound() - tolerance || value > variable.upperBound() + tolerance) {
                return new LinearConstraint("bounds_" + variable.name(), variable.lowerBound(),
                        variable.upperBound(), new LinearExpression().add(variable, 1.0));
            }
        }
        for (final LinearConstraint constraint : constraints) {
            if (!constraint.isSatisfied(values, tolerance)) {
                return constraint;
            }
        }
        return null;
    }
}
