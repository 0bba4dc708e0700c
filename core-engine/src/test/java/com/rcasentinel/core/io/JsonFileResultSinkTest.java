package com.rcasentinel.core.io;

import com.rcasentinel.core.model.AnalysisReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileResultSink}.
 */
class JsonFileResultSinkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write a timestamped, pretty-printed report file")
    void shouldWriteTimestampedFile() throws IOException {
        Path results = tempDir.resolve("results");
        AnalysisReport report = RcaJsonTest.findingsReport();

        new JsonFileResultSink(results, CLOCK).publish(report);

        Path file = results.resolve("rca_report_20240301_120000.json");
        assertThat(file).exists();
        String json = Files.readString(file);
        assertThat(json).contains("\n").contains("\"status\" : \"findings\"");
        assertThat(RcaJson.readReport(Files.readAllBytes(file))).isEqualTo(report);
    }

    @Test
    @DisplayName("Should fail when the results path is a regular file")
    void shouldFailOnUnwritableDirectory() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        JsonFileResultSink sink = new JsonFileResultSink(blocker, CLOCK);

        assertThatThrownBy(() -> sink.publish(AnalysisReport.noData("empty")))
                .isInstanceOf(IOException.class);
    }
}
