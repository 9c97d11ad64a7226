/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * A contiguous window of periods starting at {@code startPeriod}.
 */
public record Horizon(int startPeriod, int length) {

    public boolean isEmpty() {
        return length <= 0;
    }

    /**
     * @param offset zero based offset into the horizon
     * @return the absolute period index
     */
    public int period(final int offset) {
        return startPeriod + offset;
    }

    public int endPeriod() {
        return startPeriod + length - 1;
    }

    public boolean contains(final int period) {
        return period >= startPeriod && period <= endPeriod();
    }

    /**
     * The same window shifted forward by one period, as used by the next daily cycle.
     */
    public Horizon next() {
        return new Horizon(startPeriod + 1, length);
    }
}
