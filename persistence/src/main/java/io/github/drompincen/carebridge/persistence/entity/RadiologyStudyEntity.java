package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "radiology_studies", indexes = {
        @Index(name = "idx_radiology_session", columnList = "session_couch_id"),
        @Index(name = "idx_radiology_status_priority", columnList = "status, priority")
})
public class RadiologyStudyEntity extends MirroredEntity {

    @Column(name = "session_couch_id")
    private String sessionCouchId;

    @Column(name = "patient_cpt", length = 20)
    private String patientCpt;

    @Column(nullable = false, length = 20)
    private String modality;

    @Column(name = "body_part", length = 100)
    private String bodyPart;

    @Column(name = "study_type", length = 100)
    private String studyType;

    @Lob
    @Column(name = "clinical_indication")
    private String clinicalIndication;

    @Lob
    @Column(name = "clinical_question")
    private String clinicalQuestion;

    @Column(nullable = false, length = 20)
    private String priority = "routine";

    @Column(nullable = false, length = 20)
    private String status = "pending";

    @Column(name = "ai_priority_score", precision = 5, scale = 2)
    private BigDecimal aiPriorityScore;

    @Column(name = "ai_critical_flag", nullable = false)
    private boolean aiCriticalFlag;

    @Lob
    @Column(name = "ai_preliminary_report")
    private String aiPreliminaryReport;

    @Column(name = "dicom_series_count")
    private Integer dicomSeriesCount;

    @Column(name = "dicom_storage_path", length = 500)
    private String dicomStoragePath;

    @Column(name = "assigned_radiologist_id")
    private Long assignedRadiologistId;

    @Column(name = "ordered_at")
    private Instant orderedAt;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "performed_at")
    private Instant performedAt;

    @Column(name = "images_available_at")
    private Instant imagesAvailableAt;

    @Column(name = "study_completed_at")
    private Instant studyCompletedAt;

    public RadiologyStudyEntity() {}

    public String getSessionCouchId() { return sessionCouchId; }
    public void setSessionCouchId(String sessionCouchId) { this.sessionCouchId = sessionCouchId; }

    public String getPatientCpt() { return patientCpt; }
    public void setPatientCpt(String patientCpt) { this.patientCpt = patientCpt; }

    public String getModality() { return modality; }
    public void setModality(String modality) { this.modality = modality; }

    public String getBodyPart() { return bodyPart; }
    public void setBodyPart(String bodyPart) { this.bodyPart = bodyPart; }

    public String getStudyType() { return studyType; }
    public void setStudyType(String studyType) { this.studyType = studyType; }

    public String getClinicalIndication() { return clinicalIndication; }
    public void setClinicalIndication(String clinicalIndication) { this.clinicalIndication = clinicalIndication; }

    public String getClinicalQuestion() { return clinicalQuestion; }
    public void setClinicalQuestion(String clinicalQuestion) { this.clinicalQuestion = clinicalQuestion; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public BigDecimal getAiPriorityScore() { return aiPriorityScore; }
    public void setAiPriorityScore(BigDecimal aiPriorityScore) { this.aiPriorityScore = aiPriorityScore; }

    public boolean isAiCriticalFlag() { return aiCriticalFlag; }
    public void setAiCriticalFlag(boolean aiCriticalFlag) { this.aiCriticalFlag = aiCriticalFlag; }

    public String getAiPreliminaryReport() { return aiPreliminaryReport; }
    public void setAiPreliminaryReport(String aiPreliminaryReport) { this.aiPreliminaryReport = aiPreliminaryReport; }

    public Integer getDicomSeriesCount() { return dicomSeriesCount; }
    public void setDicomSeriesCount(Integer dicomSeriesCount) { this.dicomSeriesCount = dicomSeriesCount; }

    public String getDicomStoragePath() { return dicomStoragePath; }
    public void setDicomStoragePath(String dicomStoragePath) { this.dicomStoragePath = dicomStoragePath; }

    public Long getAssignedRadiologistId() { return assignedRadiologistId; }
    public void setAssignedRadiologistId(Long assignedRadiologistId) { this.assignedRadiologistId = assignedRadiologistId; }

    public Instant getOrderedAt() { return orderedAt; }
    public void setOrderedAt(Instant orderedAt) { this.orderedAt = orderedAt; }

    public Instant getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(Instant scheduledAt) { this.scheduledAt = scheduledAt; }

    public Instant getPerformedAt() { return performedAt; }
    public void setPerformedAt(Instant performedAt) { this.performedAt = performedAt; }

    public Instant getImagesAvailableAt() { return imagesAvailableAt; }
    public void setImagesAvailableAt(Instant imagesAvailableAt) { this.imagesAvailableAt = imagesAvailableAt; }

    public Instant getStudyCompletedAt() { return studyCompletedAt; }
    public void setStudyCompletedAt(Instant studyCompletedAt) { this.studyCompletedAt = studyCompletedAt; }
}
