package com.plant.flowsheet.component;

import com.plant.flowsheet.api.ComputationException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class StreamsTest {

    // Two-element streams: [concentration, flow]
    private static final int Q = 1;

    @Test
    public void testFlowWeightedMix() {
        double[] mixed = Streams.mix(List.of(new double[] { 10.0, 1.0 }, new double[] { 40.0, 2.0 }), Q);
        assertEquals(30.0, mixed[0], 1e-12);
        assertEquals(3.0, mixed[Q], 1e-12);
    }

    @Test
    public void testZeroFlowStreamIgnored() {
        double[] mixed = Streams.mix(List.of(new double[] { 99.0, 0.0 }, new double[] { 5.0, 4.0 }), Q);
        assertArrayEquals(new double[] { 5.0, 4.0 }, mixed, 1e-12);
    }

    @Test
    public void testNoFlowAtAllGivesZeros() {
        double[] mixed = Streams.mix(List.of(new double[] { 7.0, 0.0 }, new double[] { 8.0, 0.0 }), Q);
        assertArrayEquals(new double[] { 0.0, 0.0 }, mixed, 0.0);
    }

    @Test
    public void testAsm1Layout() {
        double[] a = new double[21];
        double[] b = new double[21];
        a[0] = 30.0;
        a[Streams.ASM1_FLOW_INDEX] = 100.0;
        b[0] = 10.0;
        b[Streams.ASM1_FLOW_INDEX] = 300.0;
        double[] mixed = Streams.mix(List.of(a, b), Streams.ASM1_FLOW_INDEX);
        assertEquals(15.0, mixed[0], 1e-12);
        assertEquals(400.0, mixed[Streams.ASM1_FLOW_INDEX], 1e-12);
    }

    @Test(expected = ComputationException.class)
    public void testWidthMismatch() {
        Streams.mix(List.of(new double[] { 1.0, 1.0 }, new double[] { 1.0, 1.0, 1.0 }), Q);
    }

    @Test(expected = ComputationException.class)
    public void testTooShortForFlow() {
        Streams.mix(List.of(new double[] { 1.0 }), Q);
    }

    @Test
    public void testWithFlowCopies() {
        double[] s = { 3.0, 2.0 };
        double[] t = Streams.withFlow(s, Q, 9.0);
        assertArrayEquals(new double[] { 3.0, 9.0 }, t, 0.0);
        assertEquals(2.0, s[Q], 0.0);
    }
}
