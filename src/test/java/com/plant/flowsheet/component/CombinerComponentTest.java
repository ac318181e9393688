package com.plant.flowsheet.component;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CombinerComponentTest {

    private final CombinerComponent mixer = new CombinerComponent(List.of("in_1", "in_2", "in_3"), "out", 1);

    @Test
    public void testMixesPresentInputs() {
        Map<String, double[]> out = mixer.step(Map.of(
                "in_1", new double[] { 10.0, 1.0 },
                "in_3", new double[] { 20.0, 1.0 }), 1.0);
        assertArrayEquals(new double[] { 15.0, 2.0 }, out.get("out"), 1e-12);
    }

    @Test
    public void testNoInputsProducesNothing() {
        assertTrue(mixer.step(Map.of(), 1.0).isEmpty());
    }

    @Test
    public void testDoesNotModifyInputs() {
        double[] a = { 10.0, 1.0 };
        mixer.step(Map.of("in_1", a, "in_2", new double[] { 0.0, 3.0 }), 1.0);
        assertArrayEquals(new double[] { 10.0, 1.0 }, a, 0.0);
    }
}
