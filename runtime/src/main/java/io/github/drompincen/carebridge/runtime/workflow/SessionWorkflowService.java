package io.github.drompincen.carebridge.runtime.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.persistence.entity.StateTransitionEntity;
import io.github.drompincen.carebridge.persistence.repository.ClinicalSessionRepository;
import io.github.drompincen.carebridge.persistence.repository.StateTransitionRepository;
import io.github.drompincen.carebridge.persistence.repository.UserRepository;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Records workflow transitions. The session row is locked for the duration of the transaction,
 * so transitions on one session are serialized and the state and its audit row commit together.
 */
@Service
public class SessionWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(SessionWorkflowService.class);

    private final ClinicalSessionRepository sessionRepository;
    private final StateTransitionRepository transitionRepository;
    private final UserRepository userRepository;
    private final WorkflowStateMachine stateMachine;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public SessionWorkflowService(ClinicalSessionRepository sessionRepository,
                                  StateTransitionRepository transitionRepository,
                                  UserRepository userRepository,
                                  WorkflowStateMachine stateMachine,
                                  ApplicationEventPublisher eventPublisher,
                                  ObjectMapper objectMapper,
                                  PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.transitionRepository = transitionRepository;
        this.userRepository = userRepository;
        this.stateMachine = stateMachine;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws SessionNotFoundException      when no live session has that id
     * @throws InvalidTransitionException    when the edge is not allowed from the current state
     * @throws DuplicateTransitionException  when the transition id was already recorded
     */
    public StateTransitionEntity transition(TransitionCommand command) {
        StateTransitionEntity recorded = transactionTemplate.execute(status -> record(command));

        eventPublisher.publishEvent(new SessionStateChangedEvent(
                recorded.getSessionCouchId(), recorded.getTransitionUuid(),
                recorded.getFromState(), recorded.getToState(),
                recorded.getUserId(), recorded.getReason(), recorded.getCreatedAt()));
        return recorded;
    }

    public StateTransitionEntity transition(String sessionCouchId, WorkflowState toState, Long actorId,
                                            String reason, Map<String, Object> metadata) {
        return transition(TransitionCommand.direct(sessionCouchId, toState, actorId, reason, metadata));
    }

    public StateTransitionEntity acceptReferral(String sessionCouchId, Long actorId, String notes) {
        return transition(sessionCouchId, WorkflowState.IN_GP_REVIEW, actorId, "gp_accepted", notes("notes", notes));
    }

    public StateTransitionEntity startTreatment(String sessionCouchId, Long actorId, String treatmentPlan) {
        return transition(sessionCouchId, WorkflowState.UNDER_TREATMENT, actorId, "treatment_plan_created",
                notes("treatment_plan", treatmentPlan));
    }

    public StateTransitionEntity requestSpecialistReferral(String sessionCouchId, Long actorId,
                                                           String specialistType, String notes) {
        Map<String, Object> metadata = notes("notes", notes);
        metadata.put("specialist_type", specialistType);
        return transition(sessionCouchId, WorkflowState.REFERRED, actorId, "specialist_referral", metadata);
    }

    public StateTransitionEntity closeSession(String sessionCouchId, Long actorId, String reason) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("closed_at", Instant.now().toString());
        return transition(sessionCouchId, WorkflowState.CLOSED, actorId, reason, metadata);
    }

    public StateTransitionEntity cancel(String sessionCouchId, Long actorId, String reason) {
        return transition(sessionCouchId, WorkflowState.CANCELLED, actorId, reason, Map.of());
    }

    public ClinicalSessionEntity getSession(String sessionCouchId) {
        return sessionRepository.findByCouchId(sessionCouchId)
                .filter(s -> !s.isDeleted())
                .orElseThrow(() -> new SessionNotFoundException(sessionCouchId));
    }

    public List<WorkflowState> allowedTransitions(String sessionCouchId) {
        return stateMachine.allowedTransitions(getSession(sessionCouchId).getWorkflowState());
    }

    public List<StateTransitionEntity> history(String sessionCouchId) {
        getSession(sessionCouchId);
        return transitionRepository.findBySessionCouchIdOrderByCreatedAtAscIdAsc(sessionCouchId);
    }

    private StateTransitionEntity record(TransitionCommand command) {
        if (transitionRepository.existsByTransitionUuid(command.transitionUuid())) {
            throw new DuplicateTransitionException(command.transitionUuid());
        }
        ClinicalSessionEntity session = sessionRepository.findForUpdateByCouchId(command.sessionCouchId())
                .filter(s -> !s.isDeleted())
                .orElseThrow(() -> new SessionNotFoundException(command.sessionCouchId()));

        WorkflowState from = session.getWorkflowState();
        stateMachine.validate(session.getCouchId(), from, command.toState());

        Long userId = command.actorId();
        if (userId != null && !userRepository.existsById(userId)) {
            log.warn("Transition {} names unknown user {}, recording without attribution",
                    command.transitionUuid(), userId);
            userId = null;
        }

        Instant now = Instant.now();
        session.setWorkflowState(command.toState());
        session.setWorkflowStateUpdatedAt(now);
        sessionRepository.save(session);

        StateTransitionEntity transition = new StateTransitionEntity();
        transition.setTransitionUuid(command.transitionUuid());
        transition.setSession(session);
        transition.setSessionCouchId(session.getCouchId());
        transition.setFromState(from);
        transition.setToState(command.toState());
        transition.setUserId(userId);
        transition.setReason(command.reason());
        transition.setMetadata(toJson(command.metadata()));
        transition.setCreatedAt(command.occurredAt() != null ? command.occurredAt() : now);
        StateTransitionEntity saved = transitionRepository.saveAndFlush(transition);

        log.debug("Recorded transition {} for session {}: {} -> {}",
                saved.getTransitionUuid(), saved.getSessionCouchId(), from, command.toState());
        return saved;
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

    private static Map<String, Object> notes(String key, String value) {
        Map<String, Object> metadata = new HashMap<>();
        if (value != null) {
            metadata.put(key, value);
        }
        return metadata;
    }
}
