/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only master, forecast, risk and inventory data taken at the start of a cycle. Workers
 * share a snapshot; nothing in it changes after {@link Builder#build()}.
 */
public final class PlanningSnapshot {
    private final Map<String, Product> products;
    private final Map<String, Location> locations;
    private final Map<PeriodKey, DemandForecast> forecasts;
    private final Map<PeriodKey, RiskAdjustment> risks;
    private final Map<ItemKey, InventoryPosition> inventory;

    private PlanningSnapshot(final Builder builder) {
        this.products = Collections.unmodifiableMap(new TreeMap<>(builder.products));
        this.locations = Collections.unmodifiableMap(new TreeMap<>(builder.locations));
        this.forecasts = Collections.unmodifiableMap(new HashMap<>(builder.forecasts));
        this.risks = Collections.unmodifiableMap(new HashMap<>(builder.risks));
        this.inventory = Collections.unmodifiableMap(new HashMap<>(builder.inventory));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the product, or null if unknown
     */
    public Product product(final String productId) {
        return products.get(productId);
    }

    /**
     * @return the location, or null if unknown
     */
    public Location location(final String locationId) {
        return locations.get(locationId);
    }

    public Collection<Product> products() {
        return products.values();
    }

    public Collection<Location> locations() {
        return locations.values();
    }

    /**
     * @return the forecast, or null if none was supplied
     */
    public DemandForecast forecast(final PeriodKey key) {
        return forecasts.get(key);
    }

    public Collection<DemandForecast> forecasts() {
        return forecasts.values();
    }

    /**
     * @return the risk adjustment for the key, identity when absent
     */
    public RiskAdjustment risk(final PeriodKey key) {
        final RiskAdjustment risk = risks.get(key);
        return risk == null ? RiskAdjustment.identity(key) : risk;
    }

    /**
     * @return the starting position of the item, empty when absent
     */
    public InventoryPosition inventory(final ItemKey item) {
        final InventoryPosition position = inventory.get(item);
        return position == null ? InventoryPosition.empty(item) : position;
    }

    public boolean hasForecasts(final ItemKey item, final Horizon horizon) {
        for (int i = 0; i < horizon.length(); i++) {
            if (forecasts.containsKey(item.at(horizon.period(i)))) {
                return true;
            }
        }
        return false;
    }

    /**
     * A builder seeded with everything in this snapshot, used to roll state forward.
     */
    public Builder toBuilder() {
        final Builder builder = new Builder();
        builder.products.putAll(products);
        builder.locations.putAll(locations);
        builder.forecasts.putAll(forecasts);
        builder.risks.putAll(risks);
        builder.inventory.putAll(inventory);
        return builder;
    }

    public static final class Builder {
        private final Map<String, Product> products = new HashMap<>();
        private final Map<String, Location> locations = new HashMap<>();
        private final Map<PeriodKey, DemandForecast> forecasts = new HashMap<>();
        private final Map<PeriodKey, RiskAdjustment> risks = new HashMap<>();
        private final Map<ItemKey, InventoryPosition> inventory = new HashMap<>();

        private Builder() { }

        public Builder addProduct(final Product product) {
            products.put(product.productId(), product);
            return this;
        }

        public Builder addLocation(final Location location) {
            locations.put(location.locationId(), location);
            return this;
        }

        public Builder addForecast(final DemandForecast forecast) {
            forecasts.put(forecast.key(), forecast);
            return this;
        }

        /**
         * Add a risk adjustment, composing it with any adjustment already present for the key.
         */
        public Builder addRisk(final RiskAdjustment risk) {
            risks.merge(risk.key(), risk, RiskAdjustment::combine);
            return this;
        }

        public Builder setInventory(final InventoryPosition position) {
            inventory.put(position.item(), position);
            return this;
        }

        public Builder clearForecasts() {
            forecasts.clear();
            risks.clear();
            return this;
        }

        public PlanningSnapshot build() {
            return new PlanningSnapshot(this);
        }
    }
}
