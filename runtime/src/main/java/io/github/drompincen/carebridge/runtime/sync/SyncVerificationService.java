package io.github.drompincen.carebridge.runtime.sync;

import io.github.drompincen.carebridge.persistence.repository.ClinicalFormRepository;
import io.github.drompincen.carebridge.persistence.repository.ClinicalSessionRepository;
import io.github.drompincen.carebridge.persistence.repository.PendingTransitionRepository;
import io.github.drompincen.carebridge.persistence.repository.ReferralRepository;
import io.github.drompincen.carebridge.persistence.repository.StateTransitionRepository;
import io.github.drompincen.carebridge.protocol.api.SyncVerificationDto;
import io.github.drompincen.carebridge.runtime.cursor.CursorStore;
import io.github.drompincen.carebridge.runtime.source.ChangeSource;
import io.github.drompincen.carebridge.runtime.source.ChangeSourceException;
import io.github.drompincen.carebridge.runtime.upsert.MirroredTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only consistency report over the mirrored tables.
 */
@Service
public class SyncVerificationService {

    private static final Logger log = LoggerFactory.getLogger(SyncVerificationService.class);

    private final MirroredTables tables;
    private final ClinicalSessionRepository sessionRepository;
    private final ClinicalFormRepository formRepository;
    private final ReferralRepository referralRepository;
    private final StateTransitionRepository transitionRepository;
    private final PendingTransitionRepository pendingRepository;
    private final CursorStore cursorStore;
    private final ChangeSource changeSource;

    public SyncVerificationService(MirroredTables tables,
                                   ClinicalSessionRepository sessionRepository,
                                   ClinicalFormRepository formRepository,
                                   ReferralRepository referralRepository,
                                   StateTransitionRepository transitionRepository,
                                   PendingTransitionRepository pendingRepository,
                                   CursorStore cursorStore,
                                   ChangeSource changeSource) {
        this.tables = tables;
        this.sessionRepository = sessionRepository;
        this.formRepository = formRepository;
        this.referralRepository = referralRepository;
        this.transitionRepository = transitionRepository;
        this.pendingRepository = pendingRepository;
        this.cursorStore = cursorStore;
        this.changeSource = changeSource;
    }

    public SyncVerificationDto verify() {
        Map<String, Long> tableCounts = new LinkedHashMap<>();
        tables.all().forEach(t -> tableCounts.put(t.type().discriminator(), t.repository().countByDeletedFalse()));
        tableCounts.put("stateTransition", transitionRepository.count());

        Map<String, Long> integrity = new LinkedHashMap<>();
        integrity.put("sessionsWithoutPatient", sessionRepository.countWithoutPatient());
        integrity.put("formsWithoutSession", formRepository.countWithoutSession());
        integrity.put("referralsWithoutSession", referralRepository.countWithoutSession());
        integrity.put("transitionsAwaitingSession", pendingRepository.count());

        return new SyncVerificationDto(
                cursorStore.current(),
                sourceDocumentCount(),
                tableCounts,
                grouped(sessionRepository.countByWorkflowState()),
                grouped(sessionRepository.countByTriagePriority()),
                integrity);
    }

    private Long sourceDocumentCount() {
        try {
            return changeSource.documentCount().stream().boxed().findFirst().orElse(null);
        } catch (ChangeSourceException e) {
            log.warn("Source document count unavailable: {}", e.getMessage());
            return null;
        }
    }

    private static Map<String, Long> grouped(List<Object[]> rows) {
        Map<String, Long> result = new TreeMap<>();
        for (Object[] row : rows) {
            result.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return result;
    }
}
