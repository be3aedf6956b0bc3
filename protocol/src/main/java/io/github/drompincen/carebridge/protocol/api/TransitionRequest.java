package io.github.drompincen.carebridge.protocol.api;

import java.util.Map;

public record TransitionRequest(
        String toState,
        Long actorId,
        String reason,
        Map<String, Object> metadata
) {}
