package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.AiRequestEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.github.drompincen.carebridge.runtime.transform.Documents.change;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiRequestTransformerTest {

    private final AiRequestTransformer transformer = new AiRequestTransformer();

    @Test
    @SuppressWarnings("unchecked")
    void businessTimeFallsBackToCreation() {
        MirroredDocument<AiRequestEntity> doc = (MirroredDocument<AiRequestEntity>) transformer.transform(change(
                "{'_id':'ai:1','type':'aiLog','task':'triage_explain','output':'text','promptHash':'abc',"
                        + "'riskFlags':['sepsis'],'latencyMs':'812','createdAt':'2024-03-01T10:00:00Z'}"));

        AiRequestEntity request = new AiRequestEntity();
        doc.fields().apply(request, true);

        assertThat(doc.header().businessTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(request.getTask()).isEqualTo("triage_explain");
        assertThat(request.getResponse()).isEqualTo("text");
        assertThat(request.getInputHash()).isEqualTo("abc");
        assertThat(request.getRiskFlags()).isEqualTo("[\"sepsis\"]");
        assertThat(request.getLatencyMs()).isEqualTo(812);
        assertThat(request.getRequestedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void latencyBeyondIntRangeIsRejectedNotWrapped() {
        assertThatThrownBy(() -> transformer.transform(change(
                "{'_id':'ai:2','type':'aiLog','task':'triage_explain','latencyMs':3000000000}")))
                .isInstanceOf(TransformException.class)
                .extracting(e -> ((TransformException) e).getReason())
                .isEqualTo(TransformException.Reason.INVALID_FIELD);
    }

    @Test
    void fractionalLatencyIsRejected() {
        assertThatThrownBy(() -> transformer.transform(change(
                "{'_id':'ai:3','type':'aiLog','task':'triage_explain','latencyMs':12.7}")))
                .isInstanceOf(TransformException.class)
                .extracting(e -> ((TransformException) e).getReason())
                .isEqualTo(TransformException.Reason.INVALID_FIELD);
    }
}
