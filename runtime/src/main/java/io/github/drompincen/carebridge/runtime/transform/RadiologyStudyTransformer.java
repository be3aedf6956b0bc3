package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.persistence.entity.RadiologyStudyEntity;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

@Component
public class RadiologyStudyTransformer extends AbstractDocumentTransformer {

    @Override
    public DocumentType type() {
        return DocumentType.RADIOLOGY_STUDY;
    }

    @Override
    public TransformedDocument transform(ChangeRecord change) {
        DocumentFields doc = fields(change);
        DocumentHeader header = header(change, doc);

        String modality = doc.requiredText("modality");
        String sessionCouchId = doc.text("sessionId", "session_id", "sessionCouchId");
        String patientCpt = doc.text("patientCpt", "patientId", "patient_cpt");
        String bodyPart = doc.text("bodyPart", "body_part");
        String studyType = doc.text("studyType", "study_type");
        String clinicalIndication = doc.text("clinicalIndication", "clinical_indication");
        String clinicalQuestion = doc.text("clinicalQuestion", "clinical_question");
        String priority = doc.textOr("routine", "priority");
        String status = doc.textOr("pending", "status");
        BigDecimal aiPriorityScore = doc.decimal("aiPriorityScore", "ai_priority_score");
        boolean aiCriticalFlag = doc.boolOr(false, "aiCriticalFlag", "ai_critical_flag");
        String aiPreliminaryReport = doc.text("aiPreliminaryReport", "ai_preliminary_report");
        Integer dicomSeriesCount = doc.integer("dicomSeriesCount", "dicom_series_count");
        String dicomStoragePath = doc.text("dicomStoragePath", "dicom_storage_path");
        Long radiologistId = doc.longValue("assignedRadiologistId", "assigned_radiologist_id");
        Instant orderedAt = doc.instant("orderedAt", "ordered_at", "createdAt");
        Instant scheduledAt = doc.instant("scheduledAt", "scheduled_at");
        Instant performedAt = doc.instant("performedAt", "performed_at");
        Instant imagesAvailableAt = doc.instant("imagesAvailableAt", "images_available_at");
        Instant completedAt = doc.instant("studyCompletedAt", "study_completed_at", "completedAt");

        return new MirroredDocument<>(type(), header, RadiologyStudyEntity.class, (study, inserted) -> {
            study.setModality(modality);
            study.setSessionCouchId(sessionCouchId);
            study.setPatientCpt(patientCpt);
            study.setBodyPart(bodyPart);
            study.setStudyType(studyType);
            study.setClinicalIndication(clinicalIndication);
            study.setClinicalQuestion(clinicalQuestion);
            study.setPriority(priority);
            study.setStatus(status);
            study.setAiPriorityScore(aiPriorityScore);
            study.setAiCriticalFlag(aiCriticalFlag);
            study.setAiPreliminaryReport(aiPreliminaryReport);
            study.setDicomSeriesCount(dicomSeriesCount);
            study.setDicomStoragePath(dicomStoragePath);
            study.setAssignedRadiologistId(radiologistId);
            study.setOrderedAt(orderedAt);
            study.setScheduledAt(scheduledAt);
            study.setPerformedAt(performedAt);
            study.setImagesAvailableAt(imagesAvailableAt);
            study.setStudyCompletedAt(completedAt);
        });
    }
}
