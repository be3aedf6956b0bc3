package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.MirroredEntity;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;

/**
 * A document destined for one of the mirrored tables.
 */
public record MirroredDocument<E extends MirroredEntity>(
        DocumentType type,
        DocumentHeader header,
        Class<E> entityType,
        FieldMapper<E> fields
) implements TransformedDocument {}
