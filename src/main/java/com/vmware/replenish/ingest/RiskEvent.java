/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import com.vmware.replenish.model.RiskAdjustment;
import com.vmware.replenish.optimizer.ValidationException;

/**
 * A risk signal from the upstream risk layer, tagged by {@code event_type}. Only the numeric
 * multipliers and the shock flag cross into the optimizer; descriptions and any other text
 * are dropped here.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RiskEvent.SupplierDelay.class, name = "supplier_delay"),
    @JsonSubTypes.Type(value = RiskEvent.DemandVolatility.class, name = "demand_volatility"),
    @JsonSubTypes.Type(value = RiskEvent.Disruption.class, name = "disruption")
})
public interface RiskEvent {

    /**
     * @return the adjustment this event applies to its (product, location, period)
     * @throws ValidationException if a required field is missing or a multiplier is not positive
     */
    RiskAdjustment toAdjustment() throws ValidationException;

    private static double positive(final Double value, final String field, final String event)
            throws ValidationException {
        final double multiplier = SnapshotDocument.require(value, field, event);
        if (!(multiplier > 0.0) || !Double.isFinite(multiplier)) {
            throw new ValidationException(event + " has non-positive " + field + ": " + multiplier);
        }
        return multiplier;
    }

    private static String describe(final String type, final String productId, final String locationId,
                                   final Integer period) throws ValidationException {
        SnapshotDocument.require(productId, "product_id", type);
        SnapshotDocument.require(locationId, "location_id", type);
        SnapshotDocument.require(period, "period", type);
        return type + " " + productId + "@" + locationId + " period " + period;
    }

    /**
     * Longer or less reliable lead times.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SupplierDelay(
            @JsonProperty("product_id") String productId,
            @JsonProperty("location_id") String locationId,
            @JsonProperty("period") Integer period,
            @JsonProperty("lead_time_multiplier") Double leadTimeMultiplier) implements RiskEvent {

        @Override
        public RiskAdjustment toAdjustment() throws ValidationException {
            final String event = describe("supplier_delay", productId, locationId, period);
            return new RiskAdjustment(productId, locationId, period,
                    positive(leadTimeMultiplier, "lead_time_multiplier", event), 1.0, false);
        }
    }

    /**
     * Demand more uncertain than the forecast says.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record DemandVolatility(
            @JsonProperty("product_id") String productId,
            @JsonProperty("location_id") String locationId,
            @JsonProperty("period") Integer period,
            @JsonProperty("demand_variance_multiplier") Double demandVarianceMultiplier) implements RiskEvent {

        @Override
        public RiskAdjustment toAdjustment() throws ValidationException {
            final String event = describe("demand_volatility", productId, locationId, period);
            return new RiskAdjustment(productId, locationId, period, 1.0,
                    positive(demandVarianceMultiplier, "demand_variance_multiplier", event), false);
        }
    }

    /**
     * A supply shock; the configured shock factors apply on top of any multipliers given.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Disruption(
            @JsonProperty("product_id") String productId,
            @JsonProperty("location_id") String locationId,
            @JsonProperty("period") Integer period,
            @JsonProperty("lead_time_multiplier") Double leadTimeMultiplier,
            @JsonProperty("demand_variance_multiplier") Double demandVarianceMultiplier) implements RiskEvent {

        @Override
        public RiskAdjustment toAdjustment() throws ValidationException {
            final String event = describe("disruption", productId, locationId, period);
            return new RiskAdjustment(productId, locationId, period,
                    leadTimeMultiplier == null ? 1.0 : positive(leadTimeMultiplier, "lead_time_multiplier", event),
                    demandVarianceMultiplier == null
                            ? 1.0
                            : positive(demandVarianceMultiplier, "demand_variance_multiplier", event),
                    true);
        }
    }
}
