/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.replenish.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.Table;
import org.jooq.impl.DSL;

import com.vmware.replenish.model.Policy;
import com.vmware.replenish.model.Resolution;
import com.vmware.replenish.model.SolverStatus;

/**
 * Sink for the policy records of each cycle, backed by an in-memory H2 database. Also keeps,
 * per partition, the last cycle with usable policies and whether the partition needs a
 * longer re-solve next cycle.
 */
public class PolicyStore {
    static final Table<Record> POLICIES = DSL.table("policies");
    static final Field<String> CYCLE_ID = DSL.field("cycle_id", String.class);
    static final Field<String> PARTITION_ID = DSL.field("partition_id", String.class);
    static final Field<String> PRODUCT_ID = DSL.field("product_id", String.class);
    static final Field<String> LOCATION_ID = DSL.field("location_id", String.class);
    static final Field<Integer> PERIOD_INDEX = DSL.field("period_index", Integer.class);
    static final Field<Double> ORDER_QUANTITY = DSL.field("order_quantity", Double.class);
    static final Field<Double> SAFETY_STOCK = DSL.field("safety_stock", Double.class);
    static final Field<Double> REORDER_POINT = DSL.field("reorder_point", Double.class);
    static final Field<String> SOLVER_STATUS = DSL.field("solver_status", String.class);
    static final Field<String> RESOLUTION = DSL.field("resolution", String.class);
    static final Field<Double> OBJECTIVE_VALUE = DSL.field("objective_value", Double.class);

    static final Table<Record> PARTITION_STATUS = DSL.table("partition_status");
    static final Field<String> LAST_GOOD_CYCLE = DSL.field("last_good_cycle", String.class);
    static final Field<Boolean> RESOLVE_REQUESTED = DSL.field("resolve_requested", Boolean.class);

    protected Logger LOG = LogManager.getLogger(PolicyStore.class);
    protected final DSLContext conn;

    /**
     * Create a store over a fresh in-memory database.
     */
    public PolicyStore() {
        this(createConn());
    }

    /**
     * @param conn a connection whose schema was created from replenish_tables.sql
     */
    public PolicyStore(final DSLContext conn) {
        this.conn = conn;
    }

    /**
     * Open an in-memory H2 database and create the policy tables in it.
     */
    public static DSLContext createConn() {
        final DSLContext conn = DSL.using("jdbc:h2:mem:");
        final InputStream resourceAsStream = PolicyStore.class.getResourceAsStream("/replenish_tables.sql");
        assert resourceAsStream != null;
        try (final BufferedReader tables = new BufferedReader(new InputStreamReader(resourceAsStream,
                StandardCharsets.UTF_8))) {
            final String schemaAsString = tables.lines()
                    .filter(line -> !line.startsWith("--")) // remove SQL comments
                    .collect(Collectors.joining("\n"));
            for (final String createStatement : schemaAsString.split(";")) {
                if (!createStatement.isBlank()) {
                    conn.execute(createStatement);
                }
            }
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return conn;
    }

    /**
     * Store the policies of a partition for a cycle, replacing any stored earlier for the
     * same cycle and partition.
     */
    public synchronized void persist(final String cycleId, final String partitionId, final List<Policy> policies) {
        conn.transaction(configuration -> {
            final DSLContext tx = DSL.using(configuration);
            tx.deleteFrom(POLICIES)
                    .where(CYCLE_ID.eq(cycleId))
                    .and(PARTITION_ID.eq(partitionId))
                    .execute();
            for (final Policy policy : policies) {
                tx.insertInto(POLICIES)
                        .set(CYCLE_ID, cycleId)
                        .set(PARTITION_ID, partitionId)
                        .set(PRODUCT_ID, policy.productId())
                        .set(LOCATION_ID, policy.locationId())
                        .set(PERIOD_INDEX, policy.period())
                        .set(ORDER_QUANTITY, policy.orderQuantity())
                        .set(SAFETY_STOCK, policy.safetyStock())
                        .set(REORDER_POINT, policy.reorderPoint())
                        .set(SOLVER_STATUS, policy.solverStatus().name())
                        .set(RESOLUTION, policy.resolution().name())
                        .set(OBJECTIVE_VALUE, policy.objectiveValue())
                        .execute();
            }
        });
        LOG.debug("Persisted {} policies of partition {} for cycle {}", policies.size(), partitionId, cycleId);
    }

    /**
     * @return every policy of a cycle, ordered by product, location and period
     */
    public synchronized List<Policy> policiesForCycle(final String cycleId) {
        return toPolicies(conn.select(PRODUCT_ID, LOCATION_ID, PERIOD_INDEX, ORDER_QUANTITY, SAFETY_STOCK,
                        REORDER_POINT, SOLVER_STATUS, OBJECTIVE_VALUE, RESOLUTION)
                .from(POLICIES)
                .where(CYCLE_ID.eq(cycleId))
                .orderBy(PRODUCT_ID, LOCATION_ID, PERIOD_INDEX)
                .fetch());
    }

    public synchronized List<Policy> policies(final String cycleId, final String partitionId) {
        return toPolicies(conn.select(PRODUCT_ID, LOCATION_ID, PERIOD_INDEX, ORDER_QUANTITY, SAFETY_STOCK,
                        REORDER_POINT, SOLVER_STATUS, OBJECTIVE_VALUE, RESOLUTION)
                .from(POLICIES)
                .where(CYCLE_ID.eq(cycleId))
                .and(PARTITION_ID.eq(partitionId))
                .orderBy(PRODUCT_ID, LOCATION_ID, PERIOD_INDEX)
                .fetch());
    }

    /**
     * Record that the policies persisted for a partition in a cycle are usable as a fallback.
     */
    public synchronized void markLastKnownGood(final String partitionId, final String cycleId) {
        ensureStatusRow(partitionId);
        conn.update(PARTITION_STATUS)
                .set(LAST_GOOD_CYCLE, cycleId)
                .where(PARTITION_ID.eq(partitionId))
                .execute();
    }

    /**
     * @return the cycle whose policies last succeeded for the partition, or null
     */
    public synchronized String lastKnownGoodCycle(final String partitionId) {
        final Record record = conn.select(LAST_GOOD_CYCLE)
                .from(PARTITION_STATUS)
                .where(PARTITION_ID.eq(partitionId))
                .fetchOne();
        return record == null ? null : record.get(LAST_GOOD_CYCLE);
    }

    /**
     * @return the last known good policies of a partition, empty if it never succeeded
     */
    public synchronized List<Policy> lastKnownGood(final String partitionId) {
        final String cycleId = lastKnownGoodCycle(partitionId);
        if (cycleId == null) {
            return List.of();
        }
        return policies(cycleId, partitionId);
    }

    public synchronized void requestResolve(final String partitionId, final boolean requested) {
        ensureStatusRow(partitionId);
        conn.update(PARTITION_STATUS)
                .set(RESOLVE_REQUESTED, requested)
                .where(PARTITION_ID.eq(partitionId))
                .execute();
    }

    public synchronized boolean isResolveRequested(final String partitionId) {
        final Record record = conn.select(RESOLVE_REQUESTED)
                .from(PARTITION_STATUS)
                .where(PARTITION_ID.eq(partitionId))
                .fetchOne();
        return record != null && Boolean.TRUE.equals(record.get(RESOLVE_REQUESTED));
    }

    /**
     * Print the number of records per resolution of a cycle.
     */
    public synchronized void printStats(final String cycleId) {
        System.out.println(conn.fetch("select resolution, solver_status, count(*) as records, "
                + "sum(order_quantity) as ordered from policies where cycle_id = ? "
                + "group by resolution, solver_status order by resolution, solver_status", cycleId));
        System.out.println(conn.fetch("select * from partition_status order by partition_id"));
    }

    private void ensureStatusRow(final String partitionId) {
        final int exists = conn.fetchCount(PARTITION_STATUS, PARTITION_ID.eq(partitionId));
        if (exists == 0) {
            conn.insertInto(PARTITION_STATUS)
                    .set(PARTITION_ID, partitionId)
                    .set(RESOLVE_REQUESTED, false)
                    .execute();
        }
    }

    private static List<Policy> toPolicies(final Result<? extends Record> records) {
        final List<Policy> policies = new ArrayList<>(records.size());
        for (final Record record : records) {
            policies.add(new Policy(
                    record.get(0, String.class),
                    record.get(1, String.class),
                    record.get(2, Integer.class),
                    record.get(3, Double.class),
                    record.get(4, Double.class),
                    record.get(5, Double.class),
                    SolverStatus.valueOf(record.get(6, String.class)),
                    record.get(7, Double.class),
                    Resolution.valueOf(record.get(8, String.class))));
        }
        return policies;
    }
}
