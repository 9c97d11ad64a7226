/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.distribution.NormalDistribution;

import com.vmware.replenish.model.DemandForecast;

/**
 * Safety-stock targets from forecast dispersion. The normal approximation stands in for the
 * exact chance constraint so the target enters the model as a constant lower bound.
 */
public class SafetyStockCalculator {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private final OptimizerConfig.SafetyStockMethod method;

    public SafetyStockCalculator(final OptimizerConfig.SafetyStockMethod method) {
        this.method = method;
    }

    /**
     * Standard normal inverse CDF.
     *
     * @param serviceLevel probability in (0, 1)
     * @return z such that P(Z <= z) = serviceLevel
     */
    public static double zScore(final double serviceLevel) {
        if (!(serviceLevel > 0.0 && serviceLevel < 1.0)) {
            throw new IllegalArgumentException("service level must be in (0, 1): " + serviceLevel);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(serviceLevel);
    }

    /**
     * The standard deviation of a forecast. When only quantiles are known it is estimated from
     * the widest pair of levels, or from a single level against the mean.
     *
     * @return the standard deviation, or NaN if the forecast carries no usable dispersion
     */
    public static double standardDeviation(final DemandForecast forecast) {
        if (forecast.stddev() != null) {
            return forecast.stddev();
        }
        if (forecast.quantiles().size() >= 2) {
            final Map.Entry<Double, Double> low = forecast.quantiles().firstEntry();
            final Map.Entry<Double, Double> high = forecast.quantiles().lastEntry();
            final double spread = zScore(high.getKey()) - zScore(low.getKey());
            return Math.max(0.0, (high.getValue() - low.getValue()) / spread);
        }
        if (forecast.quantiles().size() == 1) {
            final Map.Entry<Double, Double> only = forecast.quantiles().firstEntry();
            final double z = zScore(only.getKey());
            if (Math.abs(z) > 1e-9) {
                return Math.max(0.0, (only.getValue() - forecast.mean()) / z);
            }
        }
        return Double.NaN;
    }

    /**
     * Demand value at a probability level. Interpolates linearly between known quantiles and
     * falls back to the normal approximation outside them.
     */
    public static double quantile(final DemandForecast forecast, final double level) {
        final Map.Entry<Double, Double> floor = forecast.quantiles().floorEntry(level);
        final Map.Entry<Double, Double> ceiling = forecast.quantiles().ceilingEntry(level);
        if (floor != null && ceiling != null) {
            if (floor.getKey().equals(ceiling.getKey())) {
                return floor.getValue();
            }
            final double weight = (level - floor.getKey()) / (ceiling.getKey() - floor.getKey());
            return floor.getValue() + weight * (ceiling.getValue() - floor.getValue());
        }
        return forecast.mean() + zScore(level) * standardDeviation(forecast);
    }

    /**
     * Safety-stock target over a protection window.
     *
     * @param window              forecasts of the periods covered by one replenishment
     * @param varianceMultipliers risk multiplier on the demand variance, one per window period
     * @param serviceLevel        target probability of no stockout over the window
     * @return the target, never negative
     */
    public double target(final List<DemandForecast> window, final double[] varianceMultipliers,
                         final double serviceLevel) {
        assert window.size() == varianceMultipliers.length;
        double variance = 0.0;
        switch (method) {
            case NORMAL_APPROXIMATION:
                for (int i = 0; i < window.size(); i++) {
                    final double sigma = standardDeviation(window.get(i));
                    variance += sigma * sigma * varianceMultipliers[i];
                }
                return Math.max(0.0, zScore(serviceLevel) * Math.sqrt(variance));
            case EMPIRICAL_QUANTILE:
                for (int i = 0; i < window.size(); i++) {
                    final DemandForecast forecast = window.get(i);
                    final double excess = forecast.hasQuantiles()
                            ? Math.max(0.0, quantile(forecast, serviceLevel) - forecast.mean())
                            : Math.max(0.0, zScore(serviceLevel) * standardDeviation(forecast));
                    variance += excess * excess * varianceMultipliers[i];
                }
                return Math.sqrt(variance);
            default:
                throw new IllegalStateException("Unknown safety stock method " + method);
        }
    }
}
