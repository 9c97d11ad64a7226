/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Forecast demand distribution for one product, location and period. At least one of the
 * standard deviation and the quantile set is present.
 *
 * @param stddev    standard deviation, or null when only quantiles are known
 * @param quantiles probability level to demand value, possibly empty
 */
public record DemandForecast(String productId, String locationId, int period, double mean,
                             Double stddev, NavigableMap<Double, Double> quantiles) {

    public DemandForecast {
        quantiles = quantiles == null
                ? Collections.emptyNavigableMap()
                : Collections.unmodifiableNavigableMap(new TreeMap<>(quantiles));
    }

    public static DemandForecast normal(final String productId, final String locationId, final int period,
                                        final double mean, final double stddev) {
        return new DemandForecast(productId, locationId, period, mean, stddev, null);
    }

    public PeriodKey key() {
        return new PeriodKey(productId, locationId, period);
    }

    public boolean hasQuantiles() {
        return !quantiles.isEmpty();
    }
}
