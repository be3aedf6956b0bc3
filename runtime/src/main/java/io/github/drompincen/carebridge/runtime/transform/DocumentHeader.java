package io.github.drompincen.carebridge.runtime.transform;

import java.time.Instant;

/**
 * Fields every transformed document carries regardless of its type.
 *
 * @param externalId   document id in the source store
 * @param revision     revision marker of this version
 * @param businessTime client-side last-modified time, null when the document has none
 * @param actorRef     raw actor reference, resolved later to a user id
 * @param actorRole    raw actor role
 * @param rawDocument  the original document as JSON text
 */
public record DocumentHeader(
        String externalId,
        String revision,
        Instant businessTime,
        String actorRef,
        String actorRole,
        String rawDocument
) {}
