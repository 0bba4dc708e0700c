package com.rcasentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Raw topology of one snapshot, exactly as reported by the collector.
 *
 * <p>
 * No consistency is assumed here; {@link com.rcasentinel.core.graph.ServiceGraph}
 * is responsible for dropping dangling calls.
 * </p>
 *
 * @since 1.0.0
 */
public final class Topology implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Topology EMPTY = new Topology(List.of(), List.of());

    private final List<ServiceNode> nodes;
    private final List<CallEdge> calls;

    public Topology(List<ServiceNode> nodes, List<CallEdge> calls) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "Nodes must not be null"));
        this.calls = List.copyOf(Objects.requireNonNull(calls, "Calls must not be null"));
    }

    public static Topology empty() {
        return EMPTY;
    }

    public List<ServiceNode> getNodes() {
        return nodes;
    }

    public List<CallEdge> getCalls() {
        return calls;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Topology that))
            return false;
        return nodes.equals(that.nodes) && calls.equals(that.calls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, calls);
    }

    @Override
    public String toString() {
        return "Topology{nodes=" + nodes.size() + ", calls=" + calls.size() + '}';
    }
}
