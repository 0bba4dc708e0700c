package com.rcasentinel.flink;

import com.rcasentinel.core.io.SnapshotFormatException;
import com.rcasentinel.core.io.SnapshotReader;
import com.rcasentinel.core.model.Snapshot;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes → {@link Snapshot}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so that a
 * single bad snapshot does not crash the entire pipeline.
 * </p>
 */
public class SnapshotDeserializationSchema implements DeserializationSchema<Snapshot> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotDeserializationSchema.class);

    private transient SnapshotReader reader;

    @Override
    public Snapshot deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return reader().read(message);
        } catch (SnapshotFormatException e) {
            LOG.warn("Failed to deserialize snapshot, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(Snapshot nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<Snapshot> getProducedType() {
        return TypeInformation.of(Snapshot.class);
    }

    private SnapshotReader reader() {
        if (reader == null) {
            reader = new SnapshotReader();
        }
        return reader;
    }
}
