/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.optimizer.ValidationException;

/**
 * Reads a JSON planning snapshot into the typed domain model. This is the only place raw
 * records are validated for presence of their required fields.
 */
public class SnapshotReader {
    protected Logger LOG = LogManager.getLogger(SnapshotReader.class);

    private final ObjectMapper mapper;

    public SnapshotReader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, true)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    public PlanningSnapshot read(final Path path) throws IOException, ValidationException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public PlanningSnapshot read(final InputStream in) throws IOException, ValidationException {
        final SnapshotDocument document;
        try {
            document = mapper.readValue(in, SnapshotDocument.class);
        } catch (final JsonProcessingException e) {
            throw new ValidationException("Malformed snapshot: " + e.getOriginalMessage(), e);
        }
        return toSnapshot(document);
    }

    public PlanningSnapshot read(final String json) throws ValidationException {
        final SnapshotDocument document;
        try {
            document = mapper.readValue(json, SnapshotDocument.class);
        } catch (final JsonProcessingException e) {
            throw new ValidationException("Malformed snapshot: " + e.getOriginalMessage(), e);
        }
        return toSnapshot(document);
    }

    /**
     * Convert the wire document, merging risk events on the same key.
     */
    public PlanningSnapshot toSnapshot(final SnapshotDocument document) throws ValidationException {
        final PlanningSnapshot.Builder builder = PlanningSnapshot.builder();
        for (final SnapshotDocument.ProductRecord product : document.products()) {
            builder.addProduct(product.toProduct());
        }
        for (final SnapshotDocument.LocationRecord location : document.locations()) {
            builder.addLocation(location.toLocation());
        }
        for (final SnapshotDocument.ForecastRecord forecast : document.forecasts()) {
            builder.addForecast(forecast.toForecast());
        }
        for (final RiskEvent event : document.riskEvents()) {
            if (event == null) {
                throw new ValidationException("Null risk event");
            }
            builder.addRisk(event.toAdjustment());
        }
        for (final SnapshotDocument.InventoryRecord position : document.inventory()) {
            builder.setInventory(position.toPosition());
        }
        LOG.info("Read snapshot: {} products, {} locations, {} forecasts, {} risk events, {} inventory positions",
                document.products().size(), document.locations().size(), document.forecasts().size(),
                document.riskEvents().size(), document.inventory().size());
        return builder.build();
    }
}
