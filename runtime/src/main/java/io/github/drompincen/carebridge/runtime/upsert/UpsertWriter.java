package io.github.drompincen.carebridge.runtime.upsert;

import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.persistence.entity.MirroredEntity;
import io.github.drompincen.carebridge.persistence.repository.ClinicalSessionRepository;
import io.github.drompincen.carebridge.persistence.repository.StateTransitionRepository;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.runtime.conflict.ConflictResolver;
import io.github.drompincen.carebridge.runtime.transform.DocumentHeader;
import io.github.drompincen.carebridge.runtime.transform.MirroredDocument;
import io.github.drompincen.carebridge.runtime.transform.TransformedDocument;
import io.github.drompincen.carebridge.runtime.transform.TransitionDocument;
import io.github.drompincen.carebridge.runtime.workflow.DuplicateTransitionException;
import io.github.drompincen.carebridge.runtime.workflow.InvalidTransitionException;
import io.github.drompincen.carebridge.runtime.workflow.SessionNotFoundException;
import io.github.drompincen.carebridge.runtime.workflow.SessionWorkflowService;
import io.github.drompincen.carebridge.runtime.workflow.TransitionCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

/**
 * Insert-or-update by external id, one transaction per document. Transition documents are
 * handed to the workflow service instead; one naming a session not yet mirrored is held until
 * that session is written.
 */
@Service
public class UpsertWriter {

    private static final Logger log = LoggerFactory.getLogger(UpsertWriter.class);

    private final MirroredTables tables;
    private final ConflictResolver conflictResolver;
    private final UrgentReferralRule urgentReferralRule;
    private final SessionWorkflowService workflowService;
    private final StateTransitionRepository transitionRepository;
    private final ClinicalSessionRepository sessionRepository;
    private final PendingTransitions pendingTransitions;
    private final TransactionTemplate perDocument;

    public UpsertWriter(MirroredTables tables,
                        ConflictResolver conflictResolver,
                        UrgentReferralRule urgentReferralRule,
                        SessionWorkflowService workflowService,
                        StateTransitionRepository transitionRepository,
                        ClinicalSessionRepository sessionRepository,
                        PendingTransitions pendingTransitions,
                        PlatformTransactionManager transactionManager) {
        this.tables = tables;
        this.conflictResolver = conflictResolver;
        this.urgentReferralRule = urgentReferralRule;
        this.workflowService = workflowService;
        this.transitionRepository = transitionRepository;
        this.sessionRepository = sessionRepository;
        this.pendingTransitions = pendingTransitions;
        this.perDocument = new TransactionTemplate(transactionManager);
        this.perDocument.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Writes one document.
     *
     * @param actorUserId resolved actor, or null when unresolved
     * @throws DataIntegrityViolationException when the row violates a constraint even without attribution
     */
    public ApplyOutcome apply(TransformedDocument document, Long actorUserId) {
        if (document instanceof TransitionDocument transition) {
            return applyTransition(transition, actorUserId);
        }
        MirroredDocument<?> mirrored = (MirroredDocument<?>) document;
        ApplyOutcome outcome = applyMirrored(mirrored, actorUserId);
        if (outcome == ApplyOutcome.APPLIED && mirrored.type() == DocumentType.CLINICAL_SESSION) {
            pendingTransitions.drain(mirrored.header().externalId());
        }
        return outcome;
    }

    private <E extends MirroredEntity> ApplyOutcome applyMirrored(MirroredDocument<E> document, Long actorUserId) {
        MirroredTables.Table<E> table = tables.table(document.type(), document.entityType());
        try {
            return perDocument.execute(status -> write(document, table, actorUserId));
        } catch (DataIntegrityViolationException e) {
            if (actorUserId == null) {
                throw e;
            }
            log.warn("Write of {} failed with actor {}, retrying without attribution: {}",
                    document.header().externalId(), actorUserId, e.getMostSpecificCause().getMessage());
            return perDocument.execute(status -> write(document, table, null));
        }
    }

    private <E extends MirroredEntity> ApplyOutcome write(MirroredDocument<E> document, MirroredTables.Table<E> table,
                                                          Long actorUserId) {
        DocumentHeader header = document.header();
        Optional<E> existing = table.repository().findByCouchId(header.externalId());

        if (existing.isEmpty()) {
            Optional<MirroredTables.Table<?>> holder = tables.holderOf(header.externalId());
            if (holder.isPresent()) {
                log.warn("Document {} of type {} already stored as {}; skipping",
                        header.externalId(), document.type(), holder.get().type());
                return ApplyOutcome.SKIPPED_CONSTRAINT;
            }
        } else if (!conflictResolver.shouldApply(existing.get(), header)) {
            return ApplyOutcome.SKIPPED_CONFLICT;
        }

        boolean inserted = existing.isEmpty();
        E entity = existing.orElseGet(table.factory());
        if (inserted) {
            entity.setCouchId(header.externalId());
        }
        entity.setCouchRev(header.revision());
        entity.setCouchUpdatedAt(conflictResolver.orderingSignal(existing.orElse(null), header));
        entity.setSyncedAt(Instant.now());
        entity.setRawDocument(header.rawDocument());
        entity.setActorUserId(actorUserId);
        entity.setActorRole(header.actorRole());
        entity.setDeleted(false);
        String previousTriage = entity instanceof ClinicalSessionEntity prior && !inserted
                ? prior.getTriagePriority() : null;
        document.fields().apply(entity, inserted);

        E saved = table.repository().saveAndFlush(entity);
        if (saved instanceof ClinicalSessionEntity session) {
            urgentReferralRule.apply(session, inserted, previousTriage);
        }
        log.debug("{} {} {} (rev {})", inserted ? "Inserted" : "Updated", document.type(),
                header.externalId(), header.revision());
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome applyTransition(TransitionDocument document, Long actorUserId) {
        DocumentHeader header = document.header();
        TransitionCommand command = new TransitionCommand(header.externalId(), document.sessionCouchId(),
                document.toState(), actorUserId, document.reason(), document.metadata(), header.businessTime());
        try {
            workflowService.transition(command);
            return ApplyOutcome.APPLIED;
        } catch (DuplicateTransitionException e) {
            log.debug("Transition {} already recorded", header.externalId());
            return ApplyOutcome.DUPLICATE;
        } catch (SessionNotFoundException e) {
            if (sessionRepository.existsByCouchId(document.sessionCouchId())) {
                log.warn("Transition {} names deleted session {}; skipping", header.externalId(), document.sessionCouchId());
                return ApplyOutcome.SKIPPED_INVALID;
            }
            if (!pendingTransitions.defer(command)) {
                return ApplyOutcome.DUPLICATE;
            }
            log.info("Transition {} arrived before session {}; holding it", header.externalId(), document.sessionCouchId());
            return ApplyOutcome.DEFERRED;
        } catch (InvalidTransitionException e) {
            log.warn("Transition {} rejected: {}", header.externalId(), e.getMessage());
            return ApplyOutcome.TRANSITION_REJECTED;
        } catch (DataIntegrityViolationException e) {
            if (transitionRepository.existsByTransitionUuid(header.externalId())) {
                log.debug("Transition {} recorded concurrently", header.externalId());
                return ApplyOutcome.DUPLICATE;
            }
            throw e;
        }
    }

    /**
     * Sets the tombstone on whichever table holds {@code externalId}.
     *
     * @return false when no table holds it
     */
    public boolean markDeleted(String externalId, String revision) {
        Boolean found = perDocument.execute(status -> {
            for (MirroredTables.Table<?> table : tables.all()) {
                if (tombstone(table, externalId, revision)) {
                    return true;
                }
            }
            return false;
        });
        if (!Boolean.TRUE.equals(found)) {
            log.debug("Deletion of unknown document {} ignored", externalId);
            return false;
        }
        log.debug("Tombstoned {} (rev {})", externalId, revision);
        return true;
    }

    private <E extends MirroredEntity> boolean tombstone(MirroredTables.Table<E> table, String externalId, String revision) {
        Optional<E> entity = table.repository().findByCouchId(externalId);
        if (entity.isEmpty()) {
            return false;
        }
        E row = entity.get();
        row.markDeleted();
        if (revision != null) {
            row.setCouchRev(revision);
        }
        row.setSyncedAt(Instant.now());
        table.repository().save(row);
        return true;
    }
}
