/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.ingest;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.InventoryPosition;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.optimizer.ValidationException;

/**
 * Wire shape of a planning snapshot. Fields are nullable here; each record checks its
 * required fields when converted to the domain model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotDocument(
        @JsonProperty("products") List<ProductRecord> products,
        @JsonProperty("locations") List<LocationRecord> locations,
        @JsonProperty("forecasts") List<ForecastRecord> forecasts,
        @JsonProperty("risk_events") List<RiskEvent> riskEvents,
        @JsonProperty("inventory") List<InventoryRecord> inventory) {

    public SnapshotDocument {
        products = products == null ? List.of() : products;
        locations = locations == null ? List.of() : locations;
        forecasts = forecasts == null ? List.of() : forecasts;
        riskEvents = riskEvents == null ? List.of() : riskEvents;
        inventory = inventory == null ? List.of() : inventory;
    }

    static <T> T require(final T value, final String field, final String record) throws ValidationException {
        if (value == null) {
            throw new ValidationException(record + " is missing required field " + field);
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProductRecord(
            @JsonProperty("product_id") String productId,
            @JsonProperty("holding_cost") Double holdingCost,
            @JsonProperty("shortage_cost") Double shortageCost,
            @JsonProperty("ordering_cost") Double orderingCost,
            @JsonProperty("moq") Double moq,
            @JsonProperty("lead_time") Integer leadTime) {

        public Product toProduct() throws ValidationException {
            final String id = require(productId, "product_id", "product");
            final String record = "product " + id;
            return new Product(id,
                    require(holdingCost, "holding_cost", record),
                    require(shortageCost, "shortage_cost", record),
                    require(orderingCost, "ordering_cost", record),
                    moq == null ? 0.0 : moq,
                    require(leadTime, "lead_time", record));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocationRecord(
            @JsonProperty("location_id") String locationId,
            @JsonProperty("capacity") Double capacity,
            @JsonProperty("service_level_target") Double serviceLevelTarget) {

        public Location toLocation() throws ValidationException {
            final String id = require(locationId, "location_id", "location");
            final String record = "location " + id;
            return new Location(id, require(capacity, "capacity", record),
                    require(serviceLevelTarget, "service_level_target", record));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ForecastRecord(
            @JsonProperty("product_id") String productId,
            @JsonProperty("location_id") String locationId,
            @JsonProperty("period") Integer period,
            @JsonProperty("mean") Double mean,
            @JsonProperty("stddev") Double stddev,
            @JsonProperty("quantiles") Map<Double, Double> quantiles) {

        public DemandForecast toForecast() throws ValidationException {
            final String product = require(productId, "product_id", "forecast");
            final String location = require(locationId, "location_id", "forecast");
            final String record = "forecast " + product + "@" + location;
            final int at = require(period, "period", record);
            if (stddev == null && (quantiles == null || quantiles.isEmpty())) {
                throw new ValidationException(record + " at period " + at + " needs stddev or quantiles");
            }
            return new DemandForecast(product, location, at, require(mean, "mean", record), stddev,
                    quantiles == null ? null : new TreeMap<>(quantiles));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InventoryRecord(
            @JsonProperty("product_id") String productId,
            @JsonProperty("location_id") String locationId,
            @JsonProperty("on_hand") Double onHand,
            @JsonProperty("scheduled_receipts") Map<Integer, Double> scheduledReceipts) {

        public InventoryPosition toPosition() throws ValidationException {
            final String product = require(productId, "product_id", "inventory");
            final String location = require(locationId, "location_id", "inventory");
            return new InventoryPosition(product, location,
                    require(onHand, "on_hand", "inventory " + product + "@" + location), scheduledReceipts);
        }
    }
}
