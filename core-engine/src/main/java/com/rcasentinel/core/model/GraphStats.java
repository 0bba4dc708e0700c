package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Size of the service graph an analysis ran against.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "nodes", "edges", "dropped_edges" })
public final class GraphStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int nodes;
    private final int edges;
    private final int droppedEdges;

    @JsonCreator
    public GraphStats(@JsonProperty("nodes") int nodes,
            @JsonProperty("edges") int edges,
            @JsonProperty("dropped_edges") int droppedEdges) {
        this.nodes = nodes;
        this.edges = edges;
        this.droppedEdges = droppedEdges;
    }

    @JsonProperty("nodes")
    public int getNodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public int getEdges() {
        return edges;
    }

    @JsonProperty("dropped_edges")
    public int getDroppedEdges() {
        return droppedEdges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GraphStats that))
            return false;
        return nodes == that.nodes && edges == that.edges && droppedEdges == that.droppedEdges;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges, droppedEdges);
    }

    @Override
    public String toString() {
        return "GraphStats{nodes=" + nodes + ", edges=" + edges + ", droppedEdges=" + droppedEdges + '}';
    }
}
