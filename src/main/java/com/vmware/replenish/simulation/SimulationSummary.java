/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.simulation;

import java.util.EnumMap;
import java.util.Map;

import com.vmware.replenish.model.Resolution;

/**
 * Realized totals of a simulation run.
 */
public final class SimulationSummary {
    private int cycles = 0;
    private double demand = 0.0;
    private double lostSales = 0.0;
    private double holdingCost = 0.0;
    private double shortageCost = 0.0;
    private double orderingCost = 0.0;
    private double ordered = 0.0;
    private int failedCycles = 0;
    private final Map<Resolution, Integer> resolutions = new EnumMap<>(Resolution.class);

    void addCycle(final boolean partialFailure, final Map<Resolution, Integer> cycleResolutions) {
        cycles++;
        if (partialFailure) {
            failedCycles++;
        }
        for (final Map.Entry<Resolution, Integer> entry : cycleResolutions.entrySet()) {
            resolutions.merge(entry.getKey(), entry.getValue(), Integer::sum);
        }
    }

    void addPeriod(final double periodDemand, final double lost, final double holding, final double shortage,
                   final double ordering, final double quantity) {
        demand += periodDemand;
        lostSales += lost;
        holdingCost += holding;
        shortageCost += shortage;
        orderingCost += ordering;
        ordered += quantity;
    }

    public int cycles() {
        return cycles;
    }

    public double demand() {
        return demand;
    }

    public double lostSales() {
        return lostSales;
    }

    /**
     * @return the share of demand served from stock, 1 when there was no demand
     */
    public double fillRate() {
        return demand == 0.0 ? 1.0 : 1.0 - lostSales / demand;
    }

    public double holdingCost() {
        return holdingCost;
    }

    public double shortageCost() {
        return shortageCost;
    }

    public double orderingCost() {
        return orderingCost;
    }

    public double totalCost() {
        return holdingCost + shortageCost + orderingCost;
    }

    public double ordered() {
        return ordered;
    }

    /**
     * @return number of cycles that exceeded the partial failure threshold
     */
    public int failedCycles() {
        return failedCycles;
    }

    public Map<Resolution, Integer> resolutions() {
        return resolutions;
    }

    @Override
    public String toString() {
        return String.format("cycles=%d, demand=%.2f, lostSales=%.2f, fillRate=%.4f, holding=%.2f, shortage=%.2f, "
                + "ordering=%.2f, total=%.2f, ordered=%.2f, failedCycles=%d, resolutions=%s", cycles, demand,
                lostSales, fillRate(), holdingCost, shortageCost, orderingCost, totalCost(), ordered, failedCycles,
                resolutions);
    }
}
