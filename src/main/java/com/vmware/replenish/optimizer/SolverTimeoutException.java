/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

public class SolverTimeoutException extends ReplenishmentException {
    private static final long serialVersionUID = 1L;

    public SolverTimeoutException(final String message) {
        super(message);
    }
}
