package com.rcasentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the collector captured for one service in one snapshot.
 *
 * <p>
 * Metric iteration order is the order in which the collector reported the
 * metrics; detection output relies on it being stable.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final Map<String, MetricSeries> metrics;
    private final List<TraceRecord> traces;
    private final List<String> instances;

    /**
     * @param id        service id; falls back to {@code name} when {@code null}
     * @param name      service name; falls back to {@code id} when {@code null}
     * @param metrics   metric series keyed by metric name
     * @param traces    sampled traces
     * @param instances instance names
     * @throws NullPointerException if both {@code id} and {@code name} are
     *                              {@code null}
     */
    public ServiceSnapshot(String id, String name,
            Map<String, MetricSeries> metrics,
            List<TraceRecord> traces,
            List<String> instances) {
        if (id == null && name == null) {
            throw new NullPointerException("Service id and name must not both be null");
        }
        this.id = id != null ? id : name;
        this.name = name != null ? name : id;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(metrics, "Metrics must not be null")));
        this.traces = List.copyOf(Objects.requireNonNull(traces, "Traces must not be null"));
        this.instances = List.copyOf(Objects.requireNonNull(instances, "Instances must not be null"));
    }

    public static ServiceSnapshot of(String id, List<MetricSeries> series) {
        Map<String, MetricSeries> metrics = new LinkedHashMap<>();
        for (MetricSeries s : series) {
            metrics.put(s.getName(), s);
        }
        return new ServiceSnapshot(id, id, metrics, List.of(), List.of());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, MetricSeries> getMetrics() {
        return metrics;
    }

    public List<TraceRecord> getTraces() {
        return traces;
    }

    public List<String> getInstances() {
        return instances;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ServiceSnapshot that))
            return false;
        return id.equals(that.id) && name.equals(that.name)
                && metrics.equals(that.metrics)
                && traces.equals(that.traces)
                && instances.equals(that.instances);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, metrics, traces, instances);
    }

    @Override
    public String toString() {
        return "ServiceSnapshot{id='" + id + "', metrics=" + metrics.keySet()
                + ", traces=" + traces.size() + '}';
    }
}
