package com.rcasentinel.core.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rcasentinel.core.model.AnalysisReport;

import java.io.IOException;
import java.util.Objects;

/**
 * Shared Jackson configuration for reports and snapshots.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings and unknown properties are
 * ignored when reading, so older readers accept newer reports.
 * </p>
 *
 * @since 1.0.0
 */
public final class RcaJson {

    private static final ObjectMapper MAPPER = newObjectMapper();

    private RcaJson() {
        // utility class
    }

    /**
     * @return the shared, fully configured mapper; do not reconfigure it
     */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * @return a fresh mapper with the same configuration
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public static byte[] writeReport(AnalysisReport report) throws IOException {
        Objects.requireNonNull(report, "Report must not be null");
        return MAPPER.writeValueAsBytes(report);
    }

    public static AnalysisReport readReport(byte[] json) throws IOException {
        Objects.requireNonNull(json, "JSON must not be null");
        return MAPPER.readValue(json, AnalysisReport.class);
    }
}
