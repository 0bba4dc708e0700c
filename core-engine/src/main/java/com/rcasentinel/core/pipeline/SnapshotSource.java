package com.rcasentinel.core.pipeline;

import com.rcasentinel.core.model.Snapshot;

import java.io.IOException;

/**
 * Supplies the snapshot analysed by one pipeline pass, typically by querying
 * an observability backend. Retries and timeouts are the source's concern.
 */
@FunctionalInterface
public interface SnapshotSource {

    /**
     * @return the current snapshot
     * @throws IOException if the snapshot could not be obtained
     */
    Snapshot fetch() throws IOException;
}
