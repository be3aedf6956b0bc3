package io.github.drompincen.carebridge.protocol.sync;

import java.util.Arrays;
import java.util.Optional;

/**
 * Document types known to the sync engine, keyed by the {@code type} field the mobile client writes.
 */
public enum DocumentType {
    PATIENT("clinicalPatient"),
    CLINICAL_SESSION("clinicalSession"),
    CLINICAL_FORM("clinicalForm"),
    REFERRAL("referral"),
    AI_REQUEST("aiLog"),
    RADIOLOGY_STUDY("radiologyStudy"),
    STATE_TRANSITION("stateTransition");

    private final String discriminator;

    DocumentType(String discriminator) {
        this.discriminator = discriminator;
    }

    public String discriminator() {
        return discriminator;
    }

    public static Optional<DocumentType> fromDiscriminator(String discriminator) {
        return Arrays.stream(values())
                .filter(t -> t.discriminator.equals(discriminator))
                .findFirst();
    }
}
