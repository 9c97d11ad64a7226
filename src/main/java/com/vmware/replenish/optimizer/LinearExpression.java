/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sum of coefficient * variable terms. Terms keep insertion order so that backends see the
 * same model every time; adding a variable twice accumulates its coefficient.
 */
public final class LinearExpression {
    private final Map<Integer, Double> terms = new LinkedHashMap<>();

    public LinearExpression add(final Variable variable, final double coefficient) {
        if (coefficient != 0.0) {
            terms.merge(variable.index(), coefficient, Double::sum);
        }
        return this;
    }

    /**
     * @return variable index to coefficient, in insertion order
     */
    public Map<Integer, Double> terms() {
        return Collections.unmodifiableMap(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public double evaluate(final double[] values) {
        double sum = 0.0;
        for (final Map.Entry<Integer, Double> term : terms.entrySet()) {
            sum += term.getValue() * values[term.getKey()];
        }
        return sum;
    }
}
