package io.github.drompincen.carebridge.protocol.sync;

import java.util.List;

public record ChangeBatch(
        List<ChangeRecord> changes,
        String newCursor,
        boolean hasMore
) {
    public static ChangeBatch empty(String cursor) {
        return new ChangeBatch(List.of(), cursor, false);
    }
}
