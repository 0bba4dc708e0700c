package com.rcasentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcasentinel.core.io.RcaJson;
import com.rcasentinel.core.model.AnalysisReport;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts {@link AnalysisReport} → JSON
 * bytes for publishing to the Kafka reports topic.
 */
public class ReportSerializationSchema implements SerializationSchema<AnalysisReport> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ReportSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(AnalysisReport report) {
        try {
            return objectMapper().writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize report: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = RcaJson.newObjectMapper();
        }
        return mapper;
    }
}
