/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * Numeric or backend failure of a solve.
 */
public class SolverException extends ReplenishmentException {
    private static final long serialVersionUID = 1L;

    public SolverException(final String message) {
        super(message);
    }

    public SolverException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
