/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.optimizer;

public class InfeasibleModelException extends ReplenishmentException {
    private static final long serialVersionUID = 1L;

    public InfeasibleModelException(final String message) {
        super(message);
    }
}
