package io.github.drompincen.carebridge.protocol.sync;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentTypeTest {

    @Test
    void resolvesKnownDiscriminators() {
        assertThat(DocumentType.fromDiscriminator("clinicalPatient")).contains(DocumentType.PATIENT);
        assertThat(DocumentType.fromDiscriminator("aiLog")).contains(DocumentType.AI_REQUEST);
        assertThat(DocumentType.fromDiscriminator("stateTransition")).contains(DocumentType.STATE_TRANSITION);
    }

    @Test
    void discriminatorMatchIsExact() {
        assertThat(DocumentType.fromDiscriminator("ClinicalPatient")).isEmpty();
        assertThat(DocumentType.fromDiscriminator("unknownThing")).isEmpty();
        assertThat(DocumentType.fromDiscriminator(null)).isEmpty();
    }
}
