/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

/**
 * Base of every checked failure raised while turning forecasts into policies.
 */
public class ReplenishmentException extends Exception {
    private static final long serialVersionUID = 1L;

    public ReplenishmentException(final String message) {
        super(message);
    }

    public ReplenishmentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
