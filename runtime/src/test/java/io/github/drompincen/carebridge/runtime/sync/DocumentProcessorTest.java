package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.runtime.identity.IdentityResolver;
import io.github.drompincen.carebridge.runtime.transform.DocumentHeader;
import io.github.drompincen.carebridge.runtime.transform.TransformException;
import io.github.drompincen.carebridge.runtime.transform.TransformedDocument;
import io.github.drompincen.carebridge.runtime.transform.TransformerRegistry;
import io.github.drompincen.carebridge.runtime.transform.TransitionDocument;
import io.github.drompincen.carebridge.runtime.upsert.ApplyOutcome;
import io.github.drompincen.carebridge.runtime.upsert.UpsertWriter;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Map;
import java.util.Optional;

import static io.github.drompincen.carebridge.runtime.transform.Documents.change;
import static io.github.drompincen.carebridge.runtime.transform.Documents.deletion;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentProcessorTest {

    @Mock private TransformerRegistry registry;
    @Mock private IdentityResolver identityResolver;
    @Mock private UpsertWriter writer;

    private DocumentProcessor processor;
    private final ChangeRecord change = change("{'_id':'transition:t1','type':'stateTransition'}");
    private final TransformedDocument document = new TransitionDocument(
            new DocumentHeader("transition:t1", "1-a", null, "nurse@clinic.org", null, "{}"),
            "session:s1", WorkflowState.TRIAGED, null, Map.of());

    @BeforeEach
    void setUp() {
        processor = new DocumentProcessor(registry, identityResolver, writer);
        when(registry.transform(change)).thenReturn(document);
        when(identityResolver.resolve("nurse@clinic.org")).thenReturn(Optional.of(4L));
    }

    @Test
    void appliesWithResolvedActor() {
        when(writer.apply(document, 4L)).thenReturn(ApplyOutcome.APPLIED);

        assertThat(processor.process(change)).isEqualTo(DocumentResult.APPLIED);
    }

    @Test
    void outcomesMapToCycleCounters() {
        when(writer.apply(any(), any())).thenReturn(ApplyOutcome.SKIPPED_CONFLICT);
        assertThat(processor.process(change)).isEqualTo(DocumentResult.CONFLICT);

        when(writer.apply(any(), any())).thenReturn(ApplyOutcome.TRANSITION_REJECTED);
        assertThat(processor.process(change)).isEqualTo(DocumentResult.SKIPPED);

        when(writer.apply(any(), any())).thenReturn(ApplyOutcome.DUPLICATE);
        assertThat(processor.process(change)).isEqualTo(DocumentResult.UNCHANGED);

        when(writer.apply(any(), any())).thenReturn(ApplyOutcome.DEFERRED);
        assertThat(processor.process(change)).isEqualTo(DocumentResult.DEFERRED);
    }

    @Test
    void deletionsTombstoneWithoutTransforming() {
        ChangeRecord gone = deletion("session:s1", "3-c");
        when(writer.markDeleted("session:s1", "3-c")).thenReturn(true);

        assertThat(processor.process(gone)).isEqualTo(DocumentResult.DELETED);
        verify(registry, never()).transform(any());
    }

    @Test
    void validationFailureIsSkipped() {
        when(registry.transform(change)).thenThrow(
                new TransformException(TransformException.Reason.UNKNOWN_TYPE, "transition:t1", "unknown"));

        assertThat(processor.process(change)).isEqualTo(DocumentResult.SKIPPED);
    }

    @Test
    void constraintViolationIsSkipped() {
        when(writer.apply(any(), any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThat(processor.process(change)).isEqualTo(DocumentResult.SKIPPED);
    }

    @Test
    void optimisticLockFailureRetriesOnce() {
        when(writer.apply(any(), any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(Object.class, 1L))
                .thenReturn(ApplyOutcome.APPLIED);

        assertThat(processor.process(change)).isEqualTo(DocumentResult.APPLIED);
        verify(writer, times(2)).apply(any(), any());
    }

    @Test
    void lockTimeoutAgainstATransitionRetriesOnce() {
        when(writer.apply(any(), any()))
                .thenThrow(new CannotAcquireLockException("session row locked"))
                .thenReturn(ApplyOutcome.APPLIED);

        assertThat(processor.process(change)).isEqualTo(DocumentResult.APPLIED);
        verify(writer, times(2)).apply(any(), any());
    }

    @Test
    void repeatedOptimisticLockFailureIsSkipped() {
        when(writer.apply(any(), any())).thenThrow(new ObjectOptimisticLockingFailureException(Object.class, 1L));

        assertThat(processor.process(change)).isEqualTo(DocumentResult.SKIPPED);
        verify(writer, times(2)).apply(any(), any());
    }

    @Test
    void unreachableStoreAbortsTheCycle() {
        when(writer.apply(any(), any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> processor.process(change)).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void unexpectedFailureIsCountedAndContained() {
        when(writer.apply(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThat(processor.process(change)).isEqualTo(DocumentResult.ERRORED);
    }

    @Test
    void documentTypeIsCarried() {
        assertThat(document.type()).isEqualTo(DocumentType.STATE_TRANSITION);
    }
}
