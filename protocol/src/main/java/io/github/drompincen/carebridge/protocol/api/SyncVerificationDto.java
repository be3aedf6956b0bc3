package io.github.drompincen.carebridge.protocol.api;

import java.util.Map;

public record SyncVerificationDto(
        String cursor,
        Long sourceDocumentCount,
        Map<String, Long> tableCounts,
        Map<String, Long> sessionsByWorkflowState,
        Map<String, Long> sessionsByTriagePriority,
        Map<String, Long> integrityIssues
) {
    public boolean consistent() {
        return integrityIssues.values().stream().allMatch(count -> count == 0);
    }
}
