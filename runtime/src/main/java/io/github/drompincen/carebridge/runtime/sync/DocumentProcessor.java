package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.runtime.identity.IdentityResolver;
import io.github.drompincen.carebridge.runtime.transform.TransformException;
import io.github.drompincen.carebridge.runtime.transform.TransformedDocument;
import io.github.drompincen.carebridge.runtime.transform.TransformerRegistry;
import io.github.drompincen.carebridge.runtime.upsert.ApplyOutcome;
import io.github.drompincen.carebridge.runtime.upsert.UpsertWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Runs one change through transform, identity resolution and the writer, and classifies any
 * failure. Only an unreachable store escapes; every other failure is confined to the document.
 */
@Component
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);
    private static final int MAX_ATTEMPTS = 2;

    private final TransformerRegistry transformerRegistry;
    private final IdentityResolver identityResolver;
    private final UpsertWriter upsertWriter;

    public DocumentProcessor(TransformerRegistry transformerRegistry,
                             IdentityResolver identityResolver,
                             UpsertWriter upsertWriter) {
        this.transformerRegistry = transformerRegistry;
        this.identityResolver = identityResolver;
        this.upsertWriter = upsertWriter;
    }

    /**
     * @throws StoreUnavailableException when the relational store cannot be reached
     */
    public DocumentResult process(ChangeRecord change) {
        for (int attempt = 1; ; attempt++) {
            try {
                return processOnce(change);
            } catch (TransformException e) {
                log.warn("Skipping document {} ({}): {}", change.id(), e.getReason(), e.getMessage());
                return DocumentResult.SKIPPED;
            } catch (DataIntegrityViolationException e) {
                log.warn("Skipping document {}: constraint violation: {}", change.id(),
                        e.getMostSpecificCause().getMessage());
                return DocumentResult.SKIPPED;
            } catch (ConcurrencyFailureException e) {
                if (attempt < MAX_ATTEMPTS) {
                    log.info("Document {} raced a concurrent write, retrying", change.id());
                    continue;
                }
                log.warn("Skipping document {}: concurrent modification persisted", change.id());
                return DocumentResult.SKIPPED;
            } catch (CannotCreateTransactionException | DataAccessResourceFailureException
                     | TransientDataAccessResourceException | RecoverableDataAccessException e) {
                throw new StoreUnavailableException("Relational store unavailable while writing " + change.id(), e);
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing document {}", change.id(), e);
                return DocumentResult.ERRORED;
            }
        }
    }

    private DocumentResult processOnce(ChangeRecord change) {
        if (change.deleted()) {
            return upsertWriter.markDeleted(change.id(), change.revision())
                    ? DocumentResult.DELETED
                    : DocumentResult.UNCHANGED;
        }

        TransformedDocument document = transformerRegistry.transform(change);
        Long actorUserId = identityResolver.resolve(document.header().actorRef()).orElse(null);
        ApplyOutcome outcome = upsertWriter.apply(document, actorUserId);

        return switch (outcome) {
            case APPLIED -> DocumentResult.APPLIED;
            case DUPLICATE -> DocumentResult.UNCHANGED;
            case DEFERRED -> DocumentResult.DEFERRED;
            case SKIPPED_CONFLICT -> DocumentResult.CONFLICT;
            case SKIPPED_CONSTRAINT, SKIPPED_INVALID, TRANSITION_REJECTED -> DocumentResult.SKIPPED;
        };
    }
}
