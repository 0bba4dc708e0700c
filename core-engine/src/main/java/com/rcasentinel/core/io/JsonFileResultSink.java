package com.rcasentinel.core.io;

import com.rcasentinel.core.model.AnalysisReport;
import com.rcasentinel.core.pipeline.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * {@link ResultSink} writing each report as a pretty-printed JSON file named
 * {@code rca_report_<yyyyMMdd_HHmmss>.json} into a results directory.
 *
 * @since 1.0.0
 */
public class JsonFileResultSink implements ResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileResultSink.class);

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final Clock clock;

    public JsonFileResultSink(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "Results directory must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public void publish(AnalysisReport report) throws IOException {
        Objects.requireNonNull(report, "Report must not be null");
        Files.createDirectories(directory);
        Path file = directory.resolve("rca_report_" + FILE_STAMP.format(clock.instant()) + ".json");
        Files.write(file, RcaJson.objectMapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(report));
        LOG.info("Wrote {} report to {}", report.getStatus().label(), file);
    }

    /**
     * @return the directory reports are written to
     */
    public Path getDirectory() {
        return directory;
    }
}
