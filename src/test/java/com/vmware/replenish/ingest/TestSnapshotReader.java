package com.vmware.replenish.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;

import com.vmware.replenish.model.DemandForecast;
import com.vmware.replenish.model.InventoryPosition;
import com.vmware.replenish.model.ItemKey;
import com.vmware.replenish.model.PeriodKey;
import com.vmware.replenish.model.PlanningSnapshot;
import com.vmware.replenish.model.RiskAdjustment;
import com.vmware.replenish.optimizer.ValidationException;

public class TestSnapshotReader {

    private static PlanningSnapshot fixture() throws IOException, ValidationException {
        try (InputStream in = TestSnapshotReader.class.getResourceAsStream("/snapshot.json")) {
            assert in != null;
            return new SnapshotReader().read(in);
        }
    }

    @Test
    public void testReadSnapshot() throws IOException, ValidationException {
        final PlanningSnapshot snapshot = fixture();
        assertEquals(2, snapshot.products().size());
        assertEquals(1, snapshot.locations().size());
        assertEquals(4, snapshot.forecasts().size());

        assertEquals(20.0, snapshot.product("P1").moq(), 1e-12);
        assertEquals(1, snapshot.product("P1").leadTime());
        assertEquals(0.0, snapshot.product("P2").moq(), 1e-12);
        assertEquals(0.95, snapshot.location("L1").serviceLevelTarget(), 1e-12);

        final DemandForecast normal = snapshot.forecast(new PeriodKey("P1", "L1", 1));
        assertEquals(35.0, normal.mean(), 1e-12);
        assertEquals(7.0, normal.stddev(), 1e-12);

        final DemandForecast quantiles = snapshot.forecast(new PeriodKey("P2", "L1", 0));
        assertNull(quantiles.stddev());
        assertTrue(quantiles.hasQuantiles());
        assertEquals(17.0, quantiles.quantiles().get(0.9), 1e-12);

        final InventoryPosition position = snapshot.inventory(new ItemKey("P1", "L1"));
        assertEquals(40.0, position.onHand(), 1e-12);
        assertEquals(25.0, position.receiptsAt(1), 1e-12);
        assertEquals(0.0, snapshot.inventory(new ItemKey("P2", "L1")).onHand(), 1e-12);
    }

    @Test
    public void testRiskEventsCombine() throws IOException, ValidationException {
        final PlanningSnapshot snapshot = fixture();

        final RiskAdjustment combined = snapshot.risk(new PeriodKey("P1", "L1", 0));
        assertEquals(2.0, combined.leadTimeMultiplier(), 1e-12);
        assertEquals(1.5, combined.demandVarianceMultiplier(), 1e-12);
        assert !combined.shock();

        final RiskAdjustment disruption = snapshot.risk(new PeriodKey("P2", "L1", 1));
        assertTrue(disruption.shock());
        assertEquals(1.0, disruption.leadTimeMultiplier(), 1e-12);

        assertTrue(snapshot.risk(new PeriodKey("P1", "L1", 1)).isIdentity());
    }

    @Test
    public void testUnknownEventType() {
        final String json = "{\"risk_events\": [{\"event_type\": \"alien_invasion\", \"product_id\": \"P1\", "
                + "\"location_id\": \"L1\", \"period\": 0}]}";
        assertThrows(ValidationException.class, () -> new SnapshotReader().read(json));
    }

    @Test
    public void testMissingRequiredField() {
        final String product = "{\"products\": [{\"product_id\": \"P1\", \"holding_cost\": 1.0, "
                + "\"shortage_cost\": 10.0, \"lead_time\": 1}]}";
        final ValidationException e = assertThrows(ValidationException.class,
                () -> new SnapshotReader().read(product));
        assertTrue(e.getMessage().contains("ordering_cost"));

        final String delay = "{\"risk_events\": [{\"event_type\": \"supplier_delay\", \"product_id\": \"P1\", "
                + "\"location_id\": \"L1\", \"period\": 0}]}";
        assertThrows(ValidationException.class, () -> new SnapshotReader().read(delay));
    }

    @Test
    public void testForecastNeedsDispersion() {
        final String json = "{\"forecasts\": [{\"product_id\": \"P1\", \"location_id\": \"L1\", "
                + "\"period\": 0, \"mean\": 10.0}]}";
        assertThrows(ValidationException.class, () -> new SnapshotReader().read(json));
    }

    @Test
    public void testNonPositiveMultiplier() {
        final String json = "{\"risk_events\": [{\"event_type\": \"demand_volatility\", \"product_id\": \"P1\", "
                + "\"location_id\": \"L1\", \"period\": 0, \"demand_variance_multiplier\": 0.0}]}";
        assertThrows(ValidationException.class, () -> new SnapshotReader().read(json));
    }

    @Test
    public void testMalformedJson() {
        assertThrows(ValidationException.class, () -> new SnapshotReader().read("{\"products\": ["));
    }
}
