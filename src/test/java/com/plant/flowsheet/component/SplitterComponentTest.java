package com.plant.flowsheet.component;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SplitterComponentTest {

    private static final List<String> OUTS = List.of("out_1", "out_2");

    @Test
    public void testRatioSplitKeepsComposition() {
        SplitterComponent s = SplitterComponent.ratio("in", OUTS, new double[] { 1.0, 3.0 }, 1);
        Map<String, double[]> out = s.step(Map.of("in", new double[] { 7.0, 100.0 }), 1.0);
        assertEquals(SplitterComponent.Mode.RATIO, s.mode());
        assertArrayEquals(new double[] { 7.0, 25.0 }, out.get("out_1"), 1e-12);
        assertArrayEquals(new double[] { 7.0, 75.0 }, out.get("out_2"), 1e-12);
    }

    @Test
    public void testThresholdBelowAndAbove() {
        SplitterComponent s = SplitterComponent.threshold("in", OUTS, 60.0, 1);

        Map<String, double[]> below = s.step(Map.of("in", new double[] { 7.0, 40.0 }), 1.0);
        assertArrayEquals(new double[] { 7.0, 40.0 }, below.get("out_1"), 1e-12);
        // Empty branch is a zero vector
        assertArrayEquals(new double[] { 0.0, 0.0 }, below.get("out_2"), 0.0);

        Map<String, double[]> above = s.step(Map.of("in", new double[] { 7.0, 100.0 }), 1.0);
        assertArrayEquals(new double[] { 7.0, 60.0 }, above.get("out_1"), 1e-12);
        assertArrayEquals(new double[] { 7.0, 40.0 }, above.get("out_2"), 1e-12);
    }

    @Test
    public void testFixedSecondFlow() {
        SplitterComponent s = SplitterComponent.fixedSecond("in", OUTS, 30.0, 1);

        Map<String, double[]> out = s.step(Map.of("in", new double[] { 5.0, 100.0 }), 1.0);
        assertArrayEquals(new double[] { 5.0, 70.0 }, out.get("out_1"), 1e-12);
        assertArrayEquals(new double[] { 5.0, 30.0 }, out.get("out_2"), 1e-12);

        // Less than the pump rate: everything goes to the second output
        out = s.step(Map.of("in", new double[] { 5.0, 20.0 }), 1.0);
        assertArrayEquals(new double[] { 0.0, 0.0 }, out.get("out_1"), 0.0);
        assertArrayEquals(new double[] { 5.0, 20.0 }, out.get("out_2"), 1e-12);
    }

    @Test
    public void testZeroInletFlowKeepsComposition() {
        SplitterComponent s = SplitterComponent.ratio("in", OUTS, new double[] { 1.0, 1.0 }, 1);
        Map<String, double[]> out = s.step(Map.of("in", new double[] { 9.0, 0.0 }), 1.0);
        assertArrayEquals(new double[] { 9.0, 0.0 }, out.get("out_1"), 0.0);
        assertArrayEquals(new double[] { 9.0, 0.0 }, out.get("out_2"), 0.0);
    }

    @Test
    public void testMissingInletProducesNothing() {
        SplitterComponent s = SplitterComponent.threshold("in", OUTS, 1.0, 1);
        assertTrue(s.step(Map.of(), 1.0).isEmpty());
    }

    @Test
    public void testInvalidConfigurations() {
        assertInvalid(() -> SplitterComponent.ratio("in", OUTS, new double[] { 1.0 }, 1));
        assertInvalid(() -> SplitterComponent.ratio("in", OUTS, new double[] { 0.0, 0.0 }, 1));
        assertInvalid(() -> SplitterComponent.ratio("in", OUTS, new double[] { -1.0, 2.0 }, 1));
        assertInvalid(() -> SplitterComponent.threshold("in", List.of("a", "b", "c"), 1.0, 1));
        assertInvalid(() -> SplitterComponent.fixedSecond("in", OUTS, -5.0, 1));
    }

    private static void assertInvalid(Runnable r) {
        try {
            r.run();
            fail("Should have thrown IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }
}
