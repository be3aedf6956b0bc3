package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.PatientEntity;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.runtime.transform.TransformException.Reason;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneOffset;

/**
 * Patients arrive either in clear or with the privacy flag set. Encrypted patients keep only
 * their identifiers and the raw document; the short identifier is taken from the document id
 * ({@code patient:AB12} gives {@code AB12}).
 */
@Component
public class PatientTransformer extends AbstractDocumentTransformer {

    @Override
    public DocumentType type() {
        return DocumentType.PATIENT;
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        if (doc.boolOr(false, "encrypted")) {
            String cpt = shortIdentifierFromId(change.id());
            return new MirroredDocument<>(type(), header, PatientEntity.class, (patient, inserted) -> {
                patient.setCpt(cpt);
                patient.clearClinicalFields();
                patient.setActive(true);
                patient.setEncrypted(true);
                patient.setSource(PatientEntity.SOURCE_NURSE_MOBILE);
            });
        }

        DocumentFields patientFields = doc.objectOrSelf("patient");
        String cpt = patientFields.text("cpt", "id");
        String shortCode = patientFields.text("shortCode");
        String externalId = patientFields.text("externalId");
        LocalDate dateOfBirth = patientFields.date("dateOfBirth");
        String gender = patientFields.text("gender");
        BigDecimal weightKg = patientFields.decimal("weightKg");
        String phone = patientFields.text("phone");
        Integer visitCount = patientFields.integer("visitCount");
        boolean active = patientFields.boolOr(true, "isActive");
        Instant lastVisit = patientFields.instant("lastVisit");

        return new MirroredDocument<>(type(), header, PatientEntity.class, (patient, inserted) -> {
            patient.setCpt(cpt);
            patient.setShortCode(shortCode);
            patient.setExternalId(externalId);
            patient.setDateOfBirth(dateOfBirth);
            patient.setAgeMonths(ageInMonths(dateOfBirth));
            patient.setGender(gender);
            patient.setWeightKg(weightKg);
            patient.setPhone(phone);
            patient.setVisitCount(visitCount != null ? visitCount : 1);
            patient.setActive(active);
            patient.setEncrypted(false);
            patient.setSource(PatientEntity.SOURCE_NURSE_MOBILE);
            patient.setLastVisitAt(lastVisit);
        });
    }

    static String shortIdentifierFromId(String externalId) {
        int separator = externalId.indexOf(':');
        String cpt = separator < 0 ? "" : externalId.substring(separator + 1);
        if (cpt.isBlank()) {
            throw new TransformException(Reason.MISSING_REQUIRED_FIELD, externalId,
                    "Encrypted patient " + externalId + " has no short identifier in its id");
        }
        return cpt;
    }

    static Integer ageInMonths(LocalDate dateOfBirth) {
        if (dateOfBirth == null) return null;
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        if (dateOfBirth.isAfter(today)) return null;
        return (int) Period.between(dateOfBirth, today).toTotalMonths();
    }
}
