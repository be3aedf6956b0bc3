package io.github.drompincen.carebridge.runtime.upsert;

import io.github.drompincen.carebridge.persistence.entity.AiRequestEntity;
import io.github.drompincen.carebridge.persistence.entity.ClinicalFormEntity;
import io.github.drompincen.carebridge.persistence.entity.ClinicalSessionEntity;
import io.github.drompincen.carebridge.persistence.entity.MirroredEntity;
import io.github.drompincen.carebridge.persistence.entity.PatientEntity;
import io.github.drompincen.carebridge.persistence.entity.RadiologyStudyEntity;
import io.github.drompincen.carebridge.persistence.entity.ReferralEntity;
import io.github.drompincen.carebridge.persistence.repository.AiRequestRepository;
import io.github.drompincen.carebridge.persistence.repository.ClinicalFormRepository;
import io.github.drompincen.carebridge.persistence.repository.ClinicalSessionRepository;
import io.github.drompincen.carebridge.persistence.repository.MirroredEntityRepository;
import io.github.drompincen.carebridge.persistence.repository.PatientRepository;
import io.github.drompincen.carebridge.persistence.repository.RadiologyStudyRepository;
import io.github.drompincen.carebridge.persistence.repository.ReferralRepository;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The mirrored tables keyed by document type, each with its repository and entity factory.
 */
@Component
public class MirroredTables {

    public record Table<E extends MirroredEntity>(
            DocumentType type,
            Class<E> entityType,
            MirroredEntityRepository<E> repository,
            Supplier<E> factory
    ) {}

    private final Map<DocumentType, Table<?>> tables = new EnumMap<>(DocumentType.class);

    public MirroredTables(PatientRepository patients,
                          ClinicalSessionRepository sessions,
                          ClinicalFormRepository forms,
                          ReferralRepository referrals,
                          AiRequestRepository aiRequests,
                          RadiologyStudyRepository radiologyStudies) {
        register(new Table<>(DocumentType.PATIENT, PatientEntity.class, patients, PatientEntity::new));
        register(new Table<>(DocumentType.CLINICAL_SESSION, ClinicalSessionEntity.class, sessions, ClinicalSessionEntity::new));
        register(new Table<>(DocumentType.CLINICAL_FORM, ClinicalFormEntity.class, forms, ClinicalFormEntity::new));
        register(new Table<>(DocumentType.REFERRAL, ReferralEntity.class, referrals, ReferralEntity::new));
        register(new Table<>(DocumentType.AI_REQUEST, AiRequestEntity.class, aiRequests, AiRequestEntity::new));
        register(new Table<>(DocumentType.RADIOLOGY_STUDY, RadiologyStudyEntity.class, radiologyStudies, RadiologyStudyEntity::new));
    }

    private void register(Table<?> table) {
        tables.put(table.type(), table);
    }

    @SuppressWarnings("unchecked")
    public <E extends MirroredEntity> Table<E> table(DocumentType type, Class<E> entityType) {
        Table<?> table = tables.get(type);
        if (table == null || !table.entityType().equals(entityType)) {
            throw new IllegalArgumentException("No mirrored table for " + type + " holding " + entityType.getSimpleName());
        }
        return (Table<E>) table;
    }

    public Collection<Table<?>> all() {
        return tables.values();
    }

    /**
     * The table already holding {@code couchId}, if any.
     */
    public Optional<Table<?>> holderOf(String couchId) {
        return tables.values().stream()
                .filter(t -> t.repository().existsByCouchId(couchId))
                .findFirst();
    }
}
