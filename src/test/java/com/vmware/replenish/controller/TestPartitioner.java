package com.vmware.replenish.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Product;

public class TestPartitioner {

    private static PlanningSnapshot snapshot() {
        final PlanningSnapshot.Builder builder = PlanningSnapshot.builder();
        for (final String productId : List.of("P1", "P2", "P3")) {
            builder.addProduct(new Product(productId, 1.0, 5.0, 10.0, 0.0, 0));
        }
        // Added out of order on purpose
        for (final String locationId : List.of("L3", "L1", "L2", "L4")) {
            builder.addLocation(new Location(locationId, 100.0, 0.9));
        }
        builder.addForecast(DemandForecast.normal("P1", "L1", 0, 10.0, 1.0));
        builder.addForecast(DemandForecast.normal("P2", "L1", 0, 10.0, 1.0));
        builder.addForecast(DemandForecast.normal("P3", "L2", 0, 10.0, 1.0));
        builder.addForecast(DemandForecast.normal("P1", "L3", 0, 10.0, 1.0));
        builder.addForecast(DemandForecast.normal("P2", "L3", 0, 10.0, 1.0));
        builder.addForecast(DemandForecast.normal("P3", "L3", 0, 10.0, 1.0));
        // Outside the horizon
        builder.addForecast(DemandForecast.normal("P1", "L4", 5, 10.0, 1.0));
        return builder.build();
    }

    @Test
    public void testGroupsWholeLocations() {
        final List<Partition> partitions = Partitioner.byLocation(snapshot(), new Horizon(0, 2), 3);
        assertEquals(2, partitions.size());

        assertEquals("partition-1", partitions.get(0).partitionId());
        assertEquals(List.of("L1", "L2"), partitions.get(0).locationIds());
        assertEquals(List.of("P1", "P2", "P3"), partitions.get(0).productIds());

        assertEquals("partition-2", partitions.get(1).partitionId());
        assertEquals(List.of("L3"), partitions.get(1).locationIds());
    }

    @Test
    public void testOversizedLocationStaysWhole() {
        final List<Partition> partitions = Partitioner.byLocation(snapshot(), new Horizon(0, 2), 1);
        assertEquals(3, partitions.size());
        assertEquals(List.of("L1"), partitions.get(0).locationIds());
        assertEquals(List.of("P1", "P2"), partitions.get(0).productIds());
        assertEquals(List.of("L2"), partitions.get(1).locationIds());
        assertEquals(List.of("L3"), partitions.get(2).locationIds());
    }

    @Test
    public void testEveryItemPlannedOnce() {
        final PlanningSnapshot snapshot = snapshot();
        final Horizon horizon = new Horizon(0, 6);
        int items = 0;
        for (final Partition partition : Partitioner.byLocation(snapshot, horizon, 2)) {
            items += partition.items(snapshot, horizon).size();
        }
        assertEquals(7, items);
    }
}
