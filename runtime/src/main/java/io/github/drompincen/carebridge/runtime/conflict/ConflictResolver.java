package io.github.drompincen.carebridge.runtime.conflict;

import io.github.drompincen.carebridge.persistence.entity.MirroredEntity;
import io.github.drompincen.carebridge.runtime.transform.DocumentHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Last-write-wins by client business time. An older incoming version never replaces a newer
 * stored one; equal times favor the incoming version so that replays re-apply.
 */
@Component
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public boolean shouldApply(MirroredEntity existing, DocumentHeader incoming) {
        if (existing == null) {
            return true;
        }
        Instant stored = existing.getCouchUpdatedAt();
        Instant candidate = incoming.businessTime();
        if (stored == null || candidate == null) {
            log.warn("No usable business time comparing {} (stored={}, incoming={}), applying incoming",
                    incoming.externalId(), stored, candidate);
            return true;
        }
        if (candidate.isBefore(stored)) {
            log.info("Skipping stale version of {}: incoming {} ({}) is older than stored {} ({})",
                    incoming.externalId(), candidate, incoming.revision(), stored, existing.getCouchRev());
            return false;
        }
        return true;
    }

    /**
     * The ordering signal to store after applying {@code incoming}; never moves backwards and
     * never clears a known value.
     */
    public Instant orderingSignal(MirroredEntity existing, DocumentHeader incoming) {
        Instant stored = existing == null ? null : existing.getCouchUpdatedAt();
        Instant candidate = incoming.businessTime();
        if (stored == null) return candidate;
        if (candidate == null) return stored;
        return candidate.isAfter(stored) ? candidate : stored;
    }
}
