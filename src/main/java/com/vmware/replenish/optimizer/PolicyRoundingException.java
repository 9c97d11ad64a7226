/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * Rounding a solution to sellable units broke the MOQ or the capacity of a location.
 */
public class PolicyRoundingException extends ReplenishmentException {
    private static final long serialVersionUID = 1L;

    public PolicyRoundingException(final String message) {
        super(message);
    }
}
