package com.rcasentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One consistent point-in-time capture of topology and per-service metrics.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable; a snapshot can be shared freely between detection workers.
 * </p>
 *
 * @since 1.0.0
 */
public final class Snapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Capture time reported by the collector, or {@code null}. */
    private final Instant timestamp;

    private final Topology topology;
    private final List<ServiceSnapshot> services;

    public Snapshot(Instant timestamp, Topology topology, List<ServiceSnapshot> services) {
        this.timestamp = timestamp;
        this.topology = Objects.requireNonNull(topology, "Topology must not be null");
        this.services = List.copyOf(Objects.requireNonNull(services, "Services must not be null"));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Topology getTopology() {
        return topology;
    }

    public List<ServiceSnapshot> getServices() {
        return services;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Snapshot that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && topology.equals(that.topology)
                && services.equals(that.services);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, topology, services);
    }

    @Override
    public String toString() {
        return "Snapshot{timestamp=" + timestamp + ", topology=" + topology
                + ", services=" + services.size() + '}';
    }
}
