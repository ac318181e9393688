package com.plant.flowsheet.plan;

import org.junit.Test;

import static org.junit.Assert.*;

public class SolverSettingsTest {

    @Test
    public void testDefaults() {
        SolverSettings s = SolverSettings.defaults();
        assertEquals(1e-6, s.tolerance(), 0.0);
        assertEquals(50, s.maxIterations());
        assertEquals(1.0, s.relaxation(), 0.0);
        assertEquals(21, s.streamWidth());
        assertEquals(SolverSettings.NonConvergencePolicy.FAIL, s.nonConvergencePolicy());
        assertEquals(SolverSettings.ResidualNorm.ABSOLUTE, s.residualNorm());
        assertTrue(s.rejectNonFinite());
    }

    @Test
    public void testAbsoluteResidual() {
        SolverSettings s = SolverSettings.defaults();
        assertEquals(0.5, s.residual(new double[] { 1.0, 2.0 }, new double[] { 1.5, 2.25 }), 1e-15);
        assertEquals(0.0, s.residual(new double[] { 3.0 }, new double[] { 3.0 }), 0.0);
    }

    @Test
    public void testRelativeResidual() {
        SolverSettings s = SolverSettings.defaults().withResidualNorm(SolverSettings.ResidualNorm.RELATIVE)
                .withRelativeFloor(1.0);
        // 10 -> 11 is 10%, 0 -> 0.5 is measured against the floor of 1
        assertEquals(0.5, s.residual(new double[] { 10.0, 0.0 }, new double[] { 11.0, 0.5 }), 1e-12);
        assertEquals(0.1, s.residual(new double[] { 10.0, 0.0 }, new double[] { 11.0, 0.05 }), 1e-12);
    }

    @Test
    public void testLengthMismatchIsInfinite() {
        assertEquals(Double.POSITIVE_INFINITY,
                SolverSettings.defaults().residual(new double[2], new double[3]), 0.0);
    }

    @Test
    public void testNaNPropagates() {
        assertTrue(Double.isNaN(SolverSettings.defaults().residual(new double[] { 0.0 },
                new double[] { Double.NaN })));
    }

    @Test
    public void testValidation() {
        SolverSettings d = SolverSettings.defaults();
        assertInvalid(() -> d.withTolerance(0.0));
        assertInvalid(() -> d.withTolerance(Double.NaN));
        assertInvalid(() -> d.withMaxIterations(0));
        assertInvalid(() -> d.withRelaxation(0.0));
        assertInvalid(() -> d.withRelaxation(1.5));
        assertInvalid(() -> d.withStreamWidth(0));
        assertInvalid(() -> d.withRelativeFloor(-1.0));
        assertInvalid(() -> d.withNonConvergencePolicy(null));
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
