package com.plant.flowsheet.io;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a flowsheet configuration file.
 *
 * Both the camel-case keys and the snake-case keys of the node-editor export
 * format are accepted.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class FlowsheetDefinition {
    private String name;
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;
    private SolverDef solver;
    @JsonAlias("parameter_tables")
    private Map<String, Map<String, Object>> parameterTables;
    private List<String> observe;

    /** One unit operation. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id;
        @JsonAlias("component_type_id")
        private String type;
        private String label;
        private Map<String, Object> parameters;
        @JsonAlias("input_handles")
        private List<PortDef> inputs;
        @JsonAlias("output_handles")
        private List<PortDef> outputs;
    }

    /**
     * A port declaration. Written either as a plain name or as
     * {@code {"id": ..., "position": ...}}; ports are ordered by position.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonDeserialize(using = PortDefDeserializer.class)
    public static final class PortDef {
        private String id;
        private int position;
    }

    /** A stream between two ports. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EdgeDef {
        private String id;
        @JsonAlias("source_node_id")
        private String source;
        @JsonAlias({ "source_handle_id", "source_port" })
        private String sourcePort;
        @JsonAlias("target_node_id")
        private String target;
        @JsonAlias({ "target_handle_id", "target_port" })
        private String targetPort;
        private double[] initial;
    }

    /** Overrides of the default solver settings; absent keys keep the default. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SolverDef {
        private Double tolerance;
        @JsonAlias("max_iterations")
        private Integer maxIterations;
        @JsonAlias("residual_norm")
        private String residualNorm;
        @JsonAlias("relative_floor")
        private Double relativeFloor;
        private Double relaxation;
        @JsonAlias("non_convergence_policy")
        private String nonConvergencePolicy;
        @JsonAlias("stream_width")
        private Integer streamWidth;
        @JsonAlias("reject_non_finite")
        private Boolean rejectNonFinite;
    }

    public static final class PortDefDeserializer extends StdDeserializer<PortDef> {

        public PortDefDeserializer() {
            super(PortDef.class);
        }

        @Override
        public PortDef deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            if (node.isTextual())
                return new PortDef(node.asText(), 0);
            if (node.isObject() && node.hasNonNull("id"))
                return new PortDef(node.get("id").asText(), node.path("position").asInt(0));
            throw JsonMappingException.from(p, "Port must be a name or an object with an 'id': " + node);
        }
    }
}
