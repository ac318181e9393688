package com.plant.flowsheet.component;

import com.plant.flowsheet.api.ComputationException;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class FirstOrderTankComponentTest {

    @Test
    public void testRepeatedCallsDoNotAdvanceState() {
        FirstOrderTankComponent tank = new FirstOrderTankComponent("in", "out", 2.0, new double[] { 0.0 });
        Map<String, double[]> inlet = Map.of("in", new double[] { 10.0 });

        // Three sweeps inside one step all integrate from the same state
        for (int i = 0; i < 3; i++)
            assertArrayEquals(new double[] { 5.0 }, tank.step(inlet, 1.0).get("out"), 1e-12);
        assertArrayEquals(new double[] { 0.0 }, tank.state(), 0.0);

        tank.commitStep();
        assertArrayEquals(new double[] { 5.0 }, tank.state(), 1e-12);
        assertArrayEquals(new double[] { 7.5 }, tank.step(inlet, 1.0).get("out"), 1e-12);
    }

    @Test
    public void testStartsFromFirstInletWithoutInitialState() {
        FirstOrderTankComponent tank = new FirstOrderTankComponent("in", "out", 1.0, null);
        assertNull(tank.state());
        assertArrayEquals(new double[] { 4.0, 2.0 },
                tank.step(Map.of("in", new double[] { 4.0, 2.0 }), 0.5).get("out"), 0.0);
        tank.commitStep();
        assertArrayEquals(new double[] { 4.0, 2.0 }, tank.state(), 0.0);
    }

    @Test
    public void testSnapshotRoundTripIncludingEmptyState() {
        FirstOrderTankComponent tank = new FirstOrderTankComponent("in", "out", 1.0, null);
        double[] empty = tank.captureState();
        assertEquals(0, empty.length);

        tank.step(Map.of("in", new double[] { 1.0 }), 0.5);
        tank.commitStep();
        double[] snap = tank.captureState();
        tank.step(Map.of("in", new double[] { 3.0 }), 0.5);
        tank.commitStep();
        assertArrayEquals(new double[] { 2.0 }, tank.state(), 1e-12);

        tank.restoreState(snap);
        assertArrayEquals(new double[] { 1.0 }, tank.state(), 0.0);
        tank.restoreState(empty);
        assertNull(tank.state());
    }

    @Test
    public void testMissingInletHoldsState() {
        FirstOrderTankComponent tank = new FirstOrderTankComponent("in", "out", 1.0, new double[] { 3.0 });
        assertArrayEquals(new double[] { 3.0 }, tank.step(Map.of(), 1.0).get("out"), 0.0);
    }

    @Test(expected = ComputationException.class)
    public void testWidthMismatch() {
        new FirstOrderTankComponent("in", "out", 1.0, new double[] { 0.0 })
                .step(Map.of("in", new double[] { 1.0, 2.0 }), 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTauMustBePositive() {
        new FirstOrderTankComponent("in", "out", 0.0, null);
    }
}
