package io.github.drompincen.carebridge.gateway.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.persistence.entity.StateTransitionEntity;
import io.github.drompincen.carebridge.protocol.api.ClinicalSessionDto;
import io.github.drompincen.carebridge.protocol.api.ErrorResponse;
import io.github.drompincen.carebridge.protocol.api.TransitionDto;
import io.github.drompincen.carebridge.protocol.api.TransitionRequest;
import io.github.drompincen.carebridge.protocol.workflow.WorkflowState;
import io.github.drompincen.carebridge.runtime.workflow.SessionWorkflowService;
import io.github.drompincen.carebridge.runtime.workflow.WorkflowStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to mirrored sessions and direct workflow transitions. Unknown sessions and
 * rejected transitions are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/sessions")
public class ClinicalSessionController {

    private static final Logger log = LoggerFactory.getLogger(ClinicalSessionController.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final SessionWorkflowService workflowService;
    private final WorkflowStateMachine stateMachine;
    private final ObjectMapper objectMapper;

    public ClinicalSessionController(SessionWorkflowService workflowService,
                                     WorkflowStateMachine stateMachine,
                                     ObjectMapper objectMapper) {
        this.workflowService = workflowService;
        this.stateMachine = stateMachine;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/{couchId}")
    public ClinicalSessionDto get(@PathVariable String couchId) {
        return toDto(workflowService.getSession(couchId));
    }

    @GetMapping("/{couchId}/transitions")
    public List<TransitionDto> history(@PathVariable String couchId) {
        return workflowService.history(couchId).stream().map(this::toDto).toList();
    }

    @GetMapping("/{couchId}/allowed-transitions")
    public List<WorkflowState> allowedTransitions(@PathVariable String couchId) {
        return workflowService.allowedTransitions(couchId);
    }

    @PostMapping("/{couchId}/transitions")
    public ResponseEntity<?> transition(@PathVariable String couchId, @RequestBody TransitionRequest req) {
        Optional<WorkflowState> toState = WorkflowState.parse(req.toState());
        if (toState.isEmpty()) {
            List<String> valid = Arrays.stream(WorkflowState.values()).map(Enum::name).toList();
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("Unknown workflow state: " + req.toState(), valid));
        }
        StateTransitionEntity recorded = workflowService.transition(
                couchId, toState.get(), req.actorId(), req.reason(), req.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(recorded));
    }

    private ClinicalSessionDto toDto(ClinicalSessionEntity s) {
        return new ClinicalSessionDto(
                s.getCouchId(),
                s.getSessionUuid(),
                s.getPatientCpt(),
                s.getStage(),
                s.getStatus(),
                s.getWorkflowState(),
                s.getWorkflowStateUpdatedAt(),
                s.getTriagePriority(),
                s.getChiefComplaint(),
                s.getActorUserId(),
                s.getActorRole(),
                s.getSessionUpdatedAt(),
                s.getSyncedAt(),
                stateMachine.allowedTransitions(s.getWorkflowState()));
    }

    private TransitionDto toDto(StateTransitionEntity t) {
        return new TransitionDto(
                t.getTransitionUuid(),
                t.getSessionCouchId(),
                t.getFromState(),
                t.getToState(),
                t.getUserId(),
                t.getReason(),
                metadata(t),
                t.getCreatedAt());
    }

    private Map<String, Object> metadata(StateTransitionEntity t) {
        if (t.getMetadata() == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(t.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Transition {} has unreadable metadata: {}", t.getTransitionUuid(), e.getOriginalMessage());
            return Map.of("raw", t.getMetadata());
        }
    }
}
