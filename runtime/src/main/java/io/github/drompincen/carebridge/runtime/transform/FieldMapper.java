package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.MirroredEntity;

/**
 * Copies the type-specific columns of a transformed document onto its entity.
 */
@FunctionalInterface
public interface FieldMapper<E extends MirroredEntity> {

    /**
     * @param inserted true when the entity is new and has never been stored
     */
    void apply(E entity, boolean inserted);
}
