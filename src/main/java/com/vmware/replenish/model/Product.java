/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

/**
 * Master data for a stocked product. Costs are per unit and period except the ordering
 * cost, which is charged once per order placed.
 *
 * @param productId    the product identifier
 * @param holdingCost  cost of one unit held at the end of a period
 * @param shortageCost cost of one unit of unmet demand
 * @param orderingCost fixed cost per order placed
 * @param moq          minimum order quantity, 0 when unconstrained
 * @param leadTime     replenishment lead time in periods
 */
public record Product(String productId, double holdingCost, double shortageCost, double orderingCost,
                      double moq, int leadTime) {
}
