package com.plant.flowsheet.io;

import com.plant.flowsheet.api.ConfigurationException;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class FlowsheetLoaderTest {

    @Test
    public void testSnakeCaseKeysAndPortPositions() {
        FlowsheetDefinition def = FlowsheetLoader.parse("""
                {
                  "name": "mix",
                  "parameter_tables": { "t": { "Q": 5 } },
                  "nodes": [
                    {
                      "id": "m",
                      "component_type_id": "combiner",
                      "input_handles": [ { "id": "b", "position": 1 }, { "id": "a", "position": 0 } ],
                      "output_handles": [ "out" ],
                      "some_editor_field": { "x": 10, "y": 20 }
                    }
                  ],
                  "edges": [
                    { "id": "e", "source_node_id": "m", "source_handle_id": "out",
                      "target_node_id": "m", "target_handle_id": "a" }
                  ],
                  "solver": { "max_iterations": 7, "non_convergence_policy": "accept" }
                }
                """);

        assertEquals("mix", def.getName());
        FlowsheetDefinition.NodeDef node = def.getNodes().get(0);
        assertEquals("combiner", node.getType());
        assertEquals("b", node.getInputs().get(0).getId());
        assertEquals(1, node.getInputs().get(0).getPosition());
        assertEquals("out", node.getOutputs().get(0).getId());
        assertEquals(0, node.getOutputs().get(0).getPosition());

        FlowsheetDefinition.EdgeDef edge = def.getEdges().get(0);
        assertEquals("m", edge.getSource());
        assertEquals("out", edge.getSourcePort());
        assertEquals("a", edge.getTargetPort());
        assertNull(edge.getInitial());

        assertEquals(Integer.valueOf(7), def.getSolver().getMaxIterations());
        assertEquals("accept", def.getSolver().getNonConvergencePolicy());
        assertEquals(5, ((Number) def.getParameterTables().get("t").get("Q")).intValue());
    }

    @Test
    public void testMalformedJson() {
        try {
            FlowsheetLoader.parse("{ \"nodes\": [ ");
            fail("Should have thrown ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().startsWith("Malformed"));
        }
    }

    @Test
    public void testBadPortDeclaration() {
        try {
            FlowsheetLoader.parse("{ \"nodes\": [ { \"id\": \"n\", \"inputs\": [ 42 ] } ] }");
            fail("Should have thrown ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("Port"));
        }
    }

    @Test
    public void testMissingFile() {
        try {
            FlowsheetLoader.load(Path.of("does", "not", "exist.json"));
            fail("Should have thrown ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingResource() {
        FlowsheetLoader.loadResource("flowsheets/nope.json");
    }

    @Test
    public void testLoadResource() {
        FlowsheetDefinition def = FlowsheetLoader.loadResource("flowsheets/affine_loop.json");
        assertEquals("affine_loop", def.getName());
        assertEquals(List.of("loop"), def.getObserve());
        assertArrayEquals(new double[] { 0.0, 0.0 }, def.getEdges().get(0).getInitial(), 0.0);
    }

    @Test
    public void testWrittenJsonReadsBack() {
        FlowsheetDefinition def = FlowsheetLoader.loadResource("flowsheets/recycle_demo.json");
        FlowsheetDefinition copy = FlowsheetLoader.parse(FlowsheetLoader.toJson(def));
        assertEquals(def.getNodes(), copy.getNodes());
        assertEquals(def.getSolver(), copy.getSolver());
        assertEquals(def.getObserve(), copy.getObserve());
    }
}
