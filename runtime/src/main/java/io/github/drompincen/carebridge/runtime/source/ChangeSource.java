package io.github.drompincen.carebridge.runtime.source;

import io.github.drompincen.carebridge.protocol.sync.ChangeBatch;

import java.util.OptionalLong;

public interface ChangeSource {

    /** Cursor that replays the full history. */
    String BEGINNING = "0";

    /**
     * Fetches up to {@code maxBatchSize} changes after {@code cursor}.
     *
     * @throws ChangeSourceException on any transport or decoding failure
     */
    ChangeBatch fetchChanges(String cursor, int maxBatchSize);

    /**
     * Number of live documents in the source, when the source can report it.
     */
    default OptionalLong documentCount() {
        return OptionalLong.empty();
    }
}
