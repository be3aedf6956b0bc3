package io.github.drompincen.carebridge.runtime.upsert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.persistence.entity.PendingTransitionEntity;
import io.github.drompincen.carebridge.persistence.repository.PendingTransitionRepository;
import io.github.drompincen.carebridge.runtime.workflow.DuplicateTransitionException;
import io.github.drompincen.carebridge.runtime.workflow.InvalidTransitionException;
import io.github.drompincen.carebridge.runtime.workflow.SessionNotFoundException;
import io.github.drompincen.carebridge.runtime.workflow.SessionWorkflowService;
import io.github.drompincen.carebridge.runtime.workflow.TransitionCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Holds transitions that arrive before their session. The feed gives no ordering between
 * documents, so a transition can precede the session it moves; it is parked here and replayed
 * once the session is written.
 */
@Component
public class PendingTransitions {

    private static final Logger log = LoggerFactory.getLogger(PendingTransitions.class);
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {};

    private final PendingTransitionRepository pendingRepository;
    private final SessionWorkflowService workflowService;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate ownTransaction;

    public PendingTransitions(PendingTransitionRepository pendingRepository,
                              SessionWorkflowService workflowService,
                              ObjectMapper objectMapper,
                              PlatformTransactionManager transactionManager) {
        this.pendingRepository = pendingRepository;
        this.workflowService = workflowService;
        this.objectMapper = objectMapper;
        this.ownTransaction = new TransactionTemplate(transactionManager);
        this.ownTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Parks a transition until its session is written.
     *
     * @return false when the transition was already parked
     */
    public boolean defer(TransitionCommand command) {
        Boolean parked = ownTransaction.execute(status -> {
            if (pendingRepository.existsByTransitionUuid(command.transitionUuid())) {
                return false;
            }
            PendingTransitionEntity pending = new PendingTransitionEntity();
            pending.setTransitionUuid(command.transitionUuid());
            pending.setSessionCouchId(command.sessionCouchId());
            pending.setToState(command.toState());
            pending.setActorUserId(command.actorId());
            pending.setReason(command.reason());
            pending.setMetadata(toJson(command.metadata()));
            pending.setOccurredAt(command.occurredAt());
            pending.setReceivedAt(Instant.now());
            pendingRepository.saveAndFlush(pending);
            return true;
        });
        return Boolean.TRUE.equals(parked);
    }

    /**
     * Replays every transition parked for {@code sessionCouchId} in arrival order. A replayed
     * transition leaves the queue whether it was recorded, already recorded, or rejected by the
     * state machine; it stays only while the session is still missing.
     *
     * @return the number of transitions recorded
     */
    public int drain(String sessionCouchId) {
        List<PendingTransitionEntity> pending = pendingRepository.findBySessionCouchIdOrderByIdAsc(sessionCouchId);
        int recorded = 0;
        for (PendingTransitionEntity entry : pending) {
            try {
                workflowService.transition(toCommand(entry));
                recorded++;
                log.info("Replayed held transition {} for session {}", entry.getTransitionUuid(), sessionCouchId);
            } catch (DuplicateTransitionException e) {
                log.debug("Held transition {} was already recorded", entry.getTransitionUuid());
            } catch (InvalidTransitionException e) {
                log.warn("Held transition {} rejected on replay: {}", entry.getTransitionUuid(), e.getMessage());
            } catch (SessionNotFoundException e) {
                log.debug("Session {} still missing, keeping held transitions", sessionCouchId);
                return recorded;
            }
            ownTransaction.executeWithoutResult(status -> pendingRepository.deleteById(entry.getId()));
        }
        return recorded;
    }

    public long count() {
        return pendingRepository.count();
    }

    private TransitionCommand toCommand(PendingTransitionEntity entry) {
        return new TransitionCommand(entry.getTransitionUuid(), entry.getSessionCouchId(), entry.getToState(),
                entry.getActorUserId(), entry.getReason(), fromJson(entry), entry.getOccurredAt());
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Transition metadata is not serializable", e);
        }
    }

    private Map<String, Object> fromJson(PendingTransitionEntity entry) {
        if (entry.getMetadata() == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entry.getMetadata(), METADATA);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Held transition " + entry.getTransitionUuid()
                    + " has unreadable metadata", e);
        }
    }
}
