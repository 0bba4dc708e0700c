package com.rcasentinel.core.pipeline;

import com.rcasentinel.core.model.AnalysisReport;

import java.io.IOException;

/**
 * Persists or forwards the report of one pipeline pass verbatim.
 */
@FunctionalInterface
public interface ResultSink {

    /**
     * @param report the report to publish
     * @throws IOException if the report could not be written
     */
    void publish(AnalysisReport report) throws IOException;
}
