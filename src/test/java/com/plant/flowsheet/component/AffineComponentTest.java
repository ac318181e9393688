package com.plant.flowsheet.component;

import com.plant.flowsheet.api.ComputationException;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class AffineComponentTest {

    @Test
    public void testScalarGainBroadcasts() {
        AffineComponent c = new AffineComponent("in", "out", new double[] { 0.5 }, new double[] { 1.0 });
        assertArrayEquals(new double[] { 1.0, 2.0, 3.0 },
                c.step(Map.of("in", new double[] { 0.0, 2.0, 4.0 }), 1.0).get("out"), 0.0);
    }

    @Test
    public void testElementWise() {
        AffineComponent c = new AffineComponent("in", "out", new double[] { 1.0, 2.0 }, new double[] { 0.0, -1.0 });
        assertArrayEquals(new double[] { 3.0, 5.0 },
                c.step(Map.of("in", new double[] { 3.0, 3.0 }), 1.0).get("out"), 0.0);
    }

    @Test(expected = ComputationException.class)
    public void testWidthMismatch() {
        new AffineComponent("in", "out", new double[] { 1.0, 2.0 }, new double[] { 0.0 })
                .step(Map.of("in", new double[] { 1.0, 2.0, 3.0 }), 1.0);
    }

    @Test
    public void testNoInputNoOutput() {
        AffineComponent c = new AffineComponent("in", "out", new double[] { 1.0 }, new double[] { 0.0 });
        assertTrue(c.step(Map.of(), 1.0).isEmpty());
    }
}
