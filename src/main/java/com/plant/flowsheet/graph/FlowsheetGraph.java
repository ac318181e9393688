package com.plant.flowsheet.graph;

import com.plant.flowsheet.api.DuplicateEdgeException;
import com.plant.flowsheet.api.DuplicateNodeException;
import com.plant.flowsheet.api.FanInViolationException;
import com.plant.flowsheet.api.UnknownReferenceException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable flowsheet topology: node and edge tables addressed by index.
 *
 * Nodes and edges live in arrays (an arena) and refer to each other by
 * integer index only, so recycle streams are plain cycles in the index tables
 * rather than cycles of object references.
 *
 * Data layout:
 * - nodes / edges: specs in insertion order. The index of a node or edge is
 * its position in these arrays and is stable for the life of the graph.
 * - edgeSource / edgeTarget: node index at each end of every edge.
 * - outOffset / outEdges: CSR index of outgoing edges. The edges leaving node
 * i are outEdges[outOffset[i]] inclusive to outEdges[outOffset[i+1]]
 * exclusive, in edge insertion order.
 * - inOffset / inEdges: the same for incoming edges.
 *
 * Validation happens once, in {@link Builder#build()}. A graph that exists is
 * a valid graph.
 */
public final class FlowsheetGraph {
    private final NodeSpec[] nodes;
    private final EdgeSpec[] edges;
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final int[] outOffset;
    private final int[] outEdges;
    private final int[] inOffset;
    private final int[] inEdges;
    private final Map<String, Integer> nodeIndex;
    private final Map<String, Integer> edgeIndex;

    private FlowsheetGraph(NodeSpec[] nodes, EdgeSpec[] edges, int[] edgeSource, int[] edgeTarget,
            int[] outOffset, int[] outEdges, int[] inOffset, int[] inEdges,
            Map<String, Integer> nodeIndex, Map<String, Integer> edgeIndex) {
        this.nodes = nodes;
        this.edges = edges;
        this.edgeSource = edgeSource;
        this.edgeTarget = edgeTarget;
        this.outOffset = outOffset;
        this.outEdges = outEdges;
        this.inOffset = inOffset;
        this.inEdges = inEdges;
        this.nodeIndex = nodeIndex;
        this.edgeIndex = edgeIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nodeCount() {
        return nodes.length;
    }

    public int edgeCount() {
        return edges.length;
    }

    public NodeSpec node(int ni) {
        return nodes[ni];
    }

    public String nodeId(int ni) {
        return nodes[ni].id();
    }

    public EdgeSpec edge(int ei) {
        return edges[ei];
    }

    public String edgeId(int ei) {
        return edges[ei].id();
    }

    /** Returns all edges in insertion order. */
    public List<EdgeSpec> edges() {
        return List.of(edges);
    }

    /** Resolves a node id to its index. */
    public int nodeIndex(String id) {
        Integer idx = nodeIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    /** Resolves an edge id to its index. */
    public int edgeIndex(String id) {
        Integer idx = edgeIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown edge: " + id);
        return idx;
    }

    public boolean containsNode(String id) {
        return nodeIndex.containsKey(id);
    }

    public boolean containsEdge(String id) {
        return edgeIndex.containsKey(id);
    }

    public int edgeSource(int ei) {
        return edgeSource[ei];
    }

    public int edgeTarget(int ei) {
        return edgeTarget[ei];
    }

    public int outEdgeCount(int ni) {
        return outOffset[ni + 1] - outOffset[ni];
    }

    /** Index of the i-th edge leaving node ni. */
    public int outEdge(int ni, int i) {
        return outEdges[outOffset[ni] + i];
    }

    /** Indices of the edges leaving node ni, in insertion order. */
    public int[] outEdges(int ni) {
        return Arrays.copyOfRange(outEdges, outOffset[ni], outOffset[ni + 1]);
    }

    /** Indices of the edges entering node ni, in insertion order. */
    public int[] inEdges(int ni) {
        return Arrays.copyOfRange(inEdges, inOffset[ni], inOffset[ni + 1]);
    }

    public int inEdgeCount(int ni) {
        return inOffset[ni + 1] - inOffset[ni];
    }

    /** Index of the i-th edge entering node ni. */
    public int inEdge(int ni, int i) {
        return inEdges[inOffset[ni] + i];
    }

    /** Distinct successor node indices of ni, in edge order. */
    public int[] successors(int ni) {
        Set<Integer> seen = new LinkedHashSet<>();
        for (int i = outOffset[ni]; i < outOffset[ni + 1]; i++)
            seen.add(edgeTarget[outEdges[i]]);
        return seen.stream().mapToInt(Integer::intValue).toArray();
    }

    /** Distinct predecessor node indices of ni, in edge order. */
    public int[] predecessors(int ni) {
        Set<Integer> seen = new LinkedHashSet<>();
        for (int i = inOffset[ni]; i < inOffset[ni + 1]; i++)
            seen.add(edgeSource[inEdges[i]]);
        return seen.stream().mapToInt(Integer::intValue).toArray();
    }

    /** True if some edge leaves and enters node ni. */
    public boolean hasSelfLoop(int ni) {
        for (int i = outOffset[ni]; i < outOffset[ni + 1]; i++)
            if (edgeTarget[outEdges[i]] == ni)
                return true;
        return false;
    }

    /**
     * Builder for {@link FlowsheetGraph}. Collects node and edge descriptors
     * and validates them on {@link #build()}.
     */
    public static final class Builder {
        private final List<NodeSpec> nodes = new ArrayList<>();
        private final List<EdgeSpec> edges = new ArrayList<>();

        public Builder addNode(NodeSpec node) {
            nodes.add(node);
            return this;
        }

        public Builder addEdge(EdgeSpec edge) {
            edges.add(edge);
            return this;
        }

        /** Convenience for edges without an initial value. */
        public Builder addEdge(String id, String sourceNode, String sourcePort, String targetNode,
                String targetPort) {
            return addEdge(new EdgeSpec(id, sourceNode, sourcePort, targetNode, targetPort));
        }

        /**
         * Validates the descriptors and compiles the index tables.
         *
         * @throws DuplicateNodeException     if two nodes share an id.
         * @throws DuplicateEdgeException     if two edges share an id.
         * @throws UnknownReferenceException  if an edge names a missing node or
         *                                    port.
         * @throws FanInViolationException    if a target port is fed twice.
         */
        public FlowsheetGraph build() {
            int n = nodes.size();
            int m = edges.size();

            // 1. Node ids
            Map<String, Integer> nodeIdx = new HashMap<>(n * 2);
            for (int i = 0; i < n; i++) {
                if (nodeIdx.putIfAbsent(nodes.get(i).id(), i) != null)
                    throw new DuplicateNodeException(nodes.get(i).id());
            }

            // 2. Edge ids and references
            Map<String, Integer> edgeIdx = new HashMap<>(m * 2);
            Map<String, String> feeders = new HashMap<>(m * 2);
            int[] src = new int[m], dst = new int[m];
            for (int ei = 0; ei < m; ei++) {
                EdgeSpec e = edges.get(ei);
                if (edgeIdx.putIfAbsent(e.id(), ei) != null)
                    throw new DuplicateEdgeException(e.id());

                Integer s = nodeIdx.get(e.sourceNode());
                if (s == null)
                    throw new UnknownReferenceException(e.id(), e.sourceNode(), "source node");
                Integer t = nodeIdx.get(e.targetNode());
                if (t == null)
                    throw new UnknownReferenceException(e.id(), e.targetNode(), "target node");
                if (!nodes.get(s).hasOutputPort(e.sourcePort()))
                    throw new UnknownReferenceException(e.id(), e.sourceNode() + "." + e.sourcePort(),
                            "output port");
                if (!nodes.get(t).hasInputPort(e.targetPort()))
                    throw new UnknownReferenceException(e.id(), e.targetNode() + "." + e.targetPort(),
                            "input port");

                String portKey = e.targetNode() + "\u0000" + e.targetPort();
                String existing = feeders.putIfAbsent(portKey, e.id());
                if (existing != null)
                    throw new FanInViolationException(e.id(), existing, e.targetNode(), e.targetPort());

                src[ei] = s;
                dst[ei] = t;
            }

            // 3. CSR adjacency, both directions
            int[] outOff = new int[n + 1], inOff = new int[n + 1];
            for (int ei = 0; ei < m; ei++) {
                outOff[src[ei] + 1]++;
                inOff[dst[ei] + 1]++;
            }
            for (int i = 0; i < n; i++) {
                outOff[i + 1] += outOff[i];
                inOff[i + 1] += inOff[i];
            }
            int[] outList = new int[m], inList = new int[m];
            int[] outFill = new int[n], inFill = new int[n];
            for (int ei = 0; ei < m; ei++) {
                outList[outOff[src[ei]] + outFill[src[ei]]++] = ei;
                inList[inOff[dst[ei]] + inFill[dst[ei]]++] = ei;
            }

            return new FlowsheetGraph(nodes.toArray(new NodeSpec[0]), edges.toArray(new EdgeSpec[0]),
                    src, dst, outOff, outList, inOff, inList,
                    Collections.unmodifiableMap(nodeIdx), Collections.unmodifiableMap(edgeIdx));
        }
    }
}
