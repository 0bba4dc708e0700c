package com.rcasentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A node of the service call graph.
 *
 * <p>
 * Synthetic nodes ({@code real == false}) are placeholders reported by the
 * topology collector, such as the user-facing entry point. They take part in
 * graph queries but never own metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceNode implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final boolean real;

    /**
     * @param id   unique node id; must not be {@code null}
     * @param name display name; falls back to {@code id} when {@code null}
     * @param real {@code false} for synthetic placeholder nodes
     */
    public ServiceNode(String id, String name, boolean real) {
        this.id = Objects.requireNonNull(id, "Node id must not be null");
        this.name = name != null ? name : id;
        this.real = real;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isReal() {
        return real;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ServiceNode that))
            return false;
        return real == that.real && id.equals(that.id) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, real);
    }

    @Override
    public String toString() {
        return "ServiceNode{id='" + id + "', name='" + name + "', real=" + real + '}';
    }
}
