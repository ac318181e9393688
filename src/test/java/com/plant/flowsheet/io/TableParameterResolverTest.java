package com.plant.flowsheet.io;

import com.plant.flowsheet.api.ConfigurationException;
import com.plant.flowsheet.api.ParameterResolver;
import com.plant.flowsheet.api.UnknownParameterException;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TableParameterResolverTest {

    private final TableParameterResolver resolver = new TableParameterResolver(Map.of(
            "asm1init", Map.of("KLA1", 240, "S_O", List.of(2.0, 1.5))))
            .withValue("QINTR", 55338.0)
            .withValue("odd.key", 7);

    @Test
    public void testTableLookup() {
        assertEquals(240.0, resolver.resolve("asm1init.KLA1"));
        assertArrayEquals(new double[] { 2.0, 1.5 }, (double[]) resolver.resolve("asm1init.S_O"), 0.0);
    }

    @Test
    public void testFlatLookup() {
        assertEquals(55338.0, resolver.resolve("QINTR"));
        // Prefix names no table: the whole reference is a flat key
        assertEquals(7.0, resolver.resolve("odd.key"));
    }

    @Test
    public void testUnknownKey() {
        try {
            resolver.resolve("asm1init.KLA5");
            fail("Should have thrown UnknownParameterException");
        } catch (UnknownParameterException e) {
            assertEquals("asm1init.KLA5", e.reference());
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testNonNumericValue() {
        new TableParameterResolver().withValue("name", "influent").resolve("name");
    }

    @Test(expected = ConfigurationException.class)
    public void testNonNumericListElement() {
        new TableParameterResolver().withTable("t", Map.of("v", List.of(1, "x"))).resolve("t.v");
    }

    @Test
    public void testReturnedArraysAreCopies() {
        TableParameterResolver r = new TableParameterResolver().withValue("v", new double[] { 1.0 });
        ((double[]) r.resolve("v"))[0] = 99.0;
        assertArrayEquals(new double[] { 1.0 }, (double[]) r.resolve("v"), 0.0);
    }

    @Test(expected = UnknownParameterException.class)
    public void testNoneResolver() {
        ParameterResolver.none().resolve("anything");
    }
}
