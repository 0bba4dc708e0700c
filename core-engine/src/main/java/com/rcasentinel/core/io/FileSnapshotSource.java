package com.rcasentinel.core.io;

import com.rcasentinel.core.model.Snapshot;
import com.rcasentinel.core.pipeline.SnapshotSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link SnapshotSource} reading a snapshot JSON document from a file, e.g. a
 * collector export replayed offline.
 *
 * @since 1.0.0
 */
public class FileSnapshotSource implements SnapshotSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotSource.class);

    private final Path path;
    private final SnapshotReader reader;

    public FileSnapshotSource(Path path) {
        this(path, new SnapshotReader());
    }

    public FileSnapshotSource(Path path, SnapshotReader reader) {
        this.path = Objects.requireNonNull(path, "Snapshot path must not be null");
        this.reader = Objects.requireNonNull(reader, "SnapshotReader must not be null");
    }

    @Override
    public Snapshot fetch() throws IOException {
        LOG.info("Reading snapshot from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return reader.read(in);
        }
    }
}
