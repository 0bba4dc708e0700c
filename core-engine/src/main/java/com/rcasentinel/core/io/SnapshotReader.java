package com.rcasentinel.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcasentinel.core.model.CallEdge;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.Sample;
import com.rcasentinel.core.model.ServiceNode;
import com.rcasentinel.core.model.ServiceSnapshot;
import com.rcasentinel.core.model.Snapshot;
import com.rcasentinel.core.model.Topology;
import com.rcasentinel.core.model.TraceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses snapshot JSON documents into {@link Snapshot}s.
 *
 * <p>
 * Collector output is inconsistent between versions, so parsing is lenient:
 * </p>
 * <ul>
 * <li>a metric series may be a plain array, {@code {values: [...]}},
 * {@code {values: {values: [...]}}} or {@code {values: [{values: [...]}]}}</li>
 * <li>points may be numbers, numeric strings or {@code {value, timestamp}}
 * objects; {@code null} points are skipped, anything else non-numeric is kept
 * as {@code NaN} so the detector can reject the series</li>
 * <li>times may be epoch seconds, epoch millis or ISO-8601, with or without
 * an offset (UTC assumed)</li>
 * </ul>
 *
 * <p>
 * Only a document that is not a JSON object is rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class SnapshotReader {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotReader.class);

    /** Epoch values above this are read as milliseconds. */
    static final double EPOCH_MILLIS_CUTOFF = 1e11;

    private final ObjectMapper mapper;

    public SnapshotReader() {
        this(RcaJson.objectMapper());
    }

    public SnapshotReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public Snapshot read(byte[] json) throws SnapshotFormatException {
        Objects.requireNonNull(json, "JSON must not be null");
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotFormatException("Failed to read snapshot: " + e.getMessage(), e);
        }
    }

    public Snapshot read(InputStream in) throws SnapshotFormatException {
        Objects.requireNonNull(in, "InputStream must not be null");
        try {
            return read(mapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotFormatException("Failed to read snapshot: " + e.getMessage(), e);
        }
    }

    /**
     * @param root parsed document
     * @return the snapshot
     * @throws SnapshotFormatException if {@code root} is not a JSON object
     */
    public Snapshot read(JsonNode root) throws SnapshotFormatException {
        if (root == null || !root.isObject()) {
            throw new SnapshotFormatException("Snapshot must be a JSON object, got "
                    + (root == null ? "nothing" : root.getNodeType()));
        }
        Instant timestamp = parseInstant(root.get("timestamp"));
        Topology topology = readTopology(root.path("topology"));
        List<ServiceSnapshot> services = new ArrayList<>();
        for (JsonNode entry : root.path("services")) {
            ServiceSnapshot service = readService(entry);
            if (service != null) {
                services.add(service);
            }
        }
        LOG.debug("Parsed snapshot: {} nodes, {} calls, {} services", topology.getNodes().size(),
                topology.getCalls().size(), services.size());
        return new Snapshot(timestamp, topology, services);
    }

    // ---------------------------------------------------------------
    // Topology
    // ---------------------------------------------------------------

    private Topology readTopology(JsonNode node) {
        List<ServiceNode> nodes = new ArrayList<>();
        for (JsonNode n : node.path("nodes")) {
            String id = text(n, "id");
            String name = text(n, "name");
            if (id == null && name == null) {
                LOG.warn("Skipping topology node without id or name: {}", n);
                continue;
            }
            boolean real = bool(n, true, "isReal", "is_real", "real");
            nodes.add(new ServiceNode(id != null ? id : name, name != null ? name : id, real));
        }
        List<CallEdge> calls = new ArrayList<>();
        for (JsonNode c : node.path("calls")) {
            String source = text(c, "source");
            String target = text(c, "target");
            if (source == null || target == null) {
                LOG.warn("Skipping call without source or target: {}", c);
                continue;
            }
            calls.add(new CallEdge(source, target));
        }
        return new Topology(nodes, calls);
    }

    // ---------------------------------------------------------------
    // Services
    // ---------------------------------------------------------------

    private ServiceSnapshot readService(JsonNode entry) {
        JsonNode identity = entry.has("service") && entry.get("service").isObject() ? entry.get("service") : entry;
        String id = text(identity, "id");
        String name = text(identity, "name");
        if (id == null && name == null) {
            LOG.warn("Skipping service entry without id or name");
            return null;
        }

        Map<String, MetricSeries> metrics = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.path("metrics").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            metrics.put(field.getKey(), new MetricSeries(field.getKey(), readSamples(field.getValue())));
        }

        List<TraceRecord> traces = new ArrayList<>();
        for (JsonNode t : entry.path("traces")) {
            traces.add(readTrace(t));
        }

        List<String> instances = new ArrayList<>();
        for (JsonNode i : entry.path("instances")) {
            String instance = i.isValueNode() ? i.asText() : firstNonNull(text(i, "name"), text(i, "id"));
            if (instance != null) {
                instances.add(instance);
            }
        }
        return new ServiceSnapshot(id, name, metrics, traces, instances);
    }

    /**
     * Unwrap the supported series envelopes down to the array of points.
     */
    static List<Sample> readSamples(JsonNode series) {
        JsonNode points = series;
        while (points != null && points.isObject() && points.has("values")) {
            points = points.get("values");
        }
        // {values: [{values: [...]}]}
        if (points != null && points.isArray() && points.size() == 1
                && points.get(0).isObject() && points.get(0).has("values")) {
            return readSamples(points.get(0));
        }

        List<Sample> samples = new ArrayList<>();
        if (points == null || !points.isArray()) {
            return samples;
        }
        for (JsonNode point : points) {
            if (point == null || point.isNull()) {
                continue;
            }
            if (point.isObject()) {
                JsonNode value = point.get("value");
                if (value == null || value.isNull()) {
                    continue;
                }
                Instant ts = parseInstant(point.has("timestamp") ? point.get("timestamp") : point.get("time"));
                samples.add(new Sample(ts, number(value)));
            } else {
                samples.add(new Sample(null, number(point)));
            }
        }
        return samples;
    }

    private static TraceRecord readTrace(JsonNode t) {
        double duration = number(t.path("duration"));
        Instant start = parseInstant(t.get("start"));
        boolean error = bool(t, false, "isError", "is_error", "error");
        return new TraceRecord(duration, start, error);
    }

    // ---------------------------------------------------------------
    // Scalars
    // ---------------------------------------------------------------

    private static double number(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * @return the instant, or {@code null} when the value is absent or
     *         unparseable
     */
    static Instant parseInstant(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return fromEpoch(node.decimalValue());
        }
        if (!node.isTextual()) {
            return null;
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return fromEpoch(new BigDecimal(text));
        } catch (NumberFormatException e) {
            LOG.trace("'{}' is not an epoch value, trying ISO-8601", text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            LOG.trace("'{}' has no offset, trying local date-time", text);
        }
        try {
            return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            LOG.warn("Ignoring unparseable timestamp '{}'", text);
            return null;
        }
    }

    private static Instant fromEpoch(BigDecimal value) {
        if (value.doubleValue() > EPOCH_MILLIS_CUTOFF) {
            return Instant.ofEpochMilli(value.longValue());
        }
        BigDecimal millis = value.movePointRight(3);
        return Instant.ofEpochMilli(millis.longValue());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static boolean bool(JsonNode node, boolean fallback, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.isBoolean() ? value.booleanValue() : Boolean.parseBoolean(value.asText());
            }
        }
        return fallback;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
