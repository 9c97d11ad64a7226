package com.vmware.replenish;

import java.util.List;

import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.Horizon;
import com.vmware.replenish.model.Location;
import com.vmware.replenish.model.Partition;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.Product;
import com.vmware.replenish.optimizer.OptimizerConfig;

/**
 * Small snapshots shared by the tests.
 */
public final class Fixtures {
    public static final String PRODUCT = "P1";
    public static final String LOCATION = "L1";

    private Fixtures() {
        // Private constructor
    }

    public static OptimizerConfig config() {
        return new OptimizerConfig.Builder()
                .setTimeLimitMillis(20_000)
                .setWorkers(2)
                .setRandomSeed(7)
                .build();
    }

    /**
     * One product at one location, one period, lead time 0, deterministic demand of 100.
     */
    public static PlanningSnapshot singlePeriod(final double capacity) {
        return PlanningSnapshot.builder()
                .addProduct(new Product(PRODUCT, 1.0, 10.0, 50.0, 0.0, 0))
                .addLocation(new Location(LOCATION, capacity, 0.95))
                .addForecast(DemandForecast.normal(PRODUCT, LOCATION, 0, 100.0, 0.0))
                .build();
    }

    /**
     * A product with lead time and uncertain demand over several periods.
     */
    public static PlanningSnapshot multiPeriod(final int periods, final double shortageCost, final double moq,
                                               final int leadTime, final double capacity) {
        final PlanningSnapshot.Builder builder = PlanningSnapshot.builder()
                .addProduct(new Product(PRODUCT, 1.0, shortageCost, 20.0, moq, leadTime))
                .addLocation(new Location(LOCATION, capacity, 0.9));
        for (int t = 0; t < periods; t++) {
            builder.addForecast(DemandForecast.normal(PRODUCT, LOCATION, t, 20.0 + 5.0 * (t % 3), 4.0));
        }
        return builder.build();
    }

    public static Partition partition(final String id, final List<String> products, final List<String> locations) {
        return new Partition(id, products, locations);
    }

    public static Partition single() {
        return partition("part-1", List.of(PRODUCT), List.of(LOCATION));
    }

    public static Horizon horizon(final int length) {
        return new Horizon(0, length);
    }
}
