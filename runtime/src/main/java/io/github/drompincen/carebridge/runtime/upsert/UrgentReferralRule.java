package io.github.drompincen.carebridge.runtime.upsert;

import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.persistence.entity.ReferralEntity;
import io.github.drompincen.carebridge.persistence.repository.ReferralRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Red-triaged sessions get a pending GP referral when none exists yet. The rule fires when a
 * session is created red or when an update moves its triage to red; re-syncing a session that
 * was already red does not recreate a referral that was closed or deleted since. Runs inside
 * the transaction that wrote the session.
 * <p>
 * Auto-referral rows originate here rather than on a device, so they carry no raw document.
 */
@Component
public class UrgentReferralRule {

    private static final Logger log = LoggerFactory.getLogger(UrgentReferralRule.class);
    static final String RED = "red";

    private final ReferralRepository referralRepository;

    public UrgentReferralRule(ReferralRepository referralRepository) {
        this.referralRepository = referralRepository;
    }

    /**
     * @param inserted       whether this write created the session row
     * @param previousTriage triage priority stored before this write, null on insert
     */
    public boolean apply(ClinicalSessionEntity session, boolean inserted, String previousTriage) {
        if (session.isDeleted() || !RED.equalsIgnoreCase(session.getTriagePriority())) {
            return false;
        }
        if (!inserted && RED.equalsIgnoreCase(previousTriage)) {
            return false;
        }
        String referralId = ReferralEntity.AUTO_REFERRAL_PREFIX + session.getCouchId();
        if (referralRepository.existsBySessionCouchIdAndPriority(session.getCouchId(), RED)
                || referralRepository.existsByCouchId(referralId)) {
            return false;
        }

        Instant now = Instant.now();
        ReferralEntity referral = new ReferralEntity();
        referral.setCouchId(referralId);
        referral.setSessionCouchId(session.getCouchId());
        referral.setAssignedToRole("gp");
        referral.setStatus("pending");
        referral.setPriority(RED);
        referral.setSpecialty("general_practice");
        referral.setReason("Urgent triage classification");
        referral.setCouchUpdatedAt(session.getCouchUpdatedAt());
        referral.setSyncedAt(now);
        referral.setAssignedAt(now);
        referralRepository.save(referral);

        log.info("Created urgent referral {} for red-triaged session {}", referralId, session.getCouchId());
        return true;
    }
}
