package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Mirrored patient. Rows synced from an encrypted document hold only the key columns,
 * the active flag and the raw document; every clinical column stays null.
 */
@Entity
@Table(name = "patients", indexes = {
        @Index(name = "idx_patients_cpt_active", columnList = "cpt, is_active"),
        @Index(name = "idx_patients_source", columnList = "source")
})
public class PatientEntity extends MirroredEntity {

    public static final String SOURCE_NURSE_MOBILE = "nurse_mobile";

    @Column(nullable = false, unique = true, length = 20)
    private String cpt;

    @Column(name = "short_code", length = 10)
    private String shortCode;

    @Column(name = "external_id")
    private String externalId;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "age_months")
    private Integer ageMonths;

    @Column(length = 10)
    private String gender;

    @Column(name = "weight_kg", precision = 5, scale = 2)
    private BigDecimal weightKg;

    @Column(length = 30)
    private String phone;

    @Column(name = "visit_count")
    private Integer visitCount;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "encrypted", nullable = false)
    private boolean encrypted;

    @Column(length = 20)
    private String source;

    @Column(name = "last_visit_at")
    private Instant lastVisitAt;

    public PatientEntity() {}

    @Override
    public void markDeleted() {
        super.markDeleted();
        this.active = false;
    }

    /**
     * Clears every clinical column, leaving the row keyed but opaque.
     */
    public void clearClinicalFields() {
        this.shortCode = null;
        this.externalId = null;
        this.dateOfBirth = null;
        this.ageMonths = null;
        this.gender = null;
        this.weightKg = null;
        this.phone = null;
        this.visitCount = null;
        this.lastVisitAt = null;
    }

    public String getCpt() { return cpt; }
    public void setCpt(String cpt) { this.cpt = cpt; }

    public String getShortCode() { return shortCode; }
    public void setShortCode(String shortCode) { this.shortCode = shortCode; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public LocalDate getDateOfBirth() { return dateOfBirth; }
    public void setDateOfBirth(LocalDate dateOfBirth) { this.dateOfBirth = dateOfBirth; }

    public Integer getAgeMonths() { return ageMonths; }
    public void setAgeMonths(Integer ageMonths) { this.ageMonths = ageMonths; }

    public String getGender() { return gender; }
    public void setGender(String gender) { this.gender = gender; }

    public BigDecimal getWeightKg() { return weightKg; }
    public void setWeightKg(BigDecimal weightKg) { this.weightKg = weightKg; }

    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }

    public Integer getVisitCount() { return visitCount; }
    public void setVisitCount(Integer visitCount) { this.visitCount = visitCount; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isEncrypted() { return encrypted; }
    public void setEncrypted(boolean encrypted) { this.encrypted = encrypted; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public Instant getLastVisitAt() { return lastVisitAt; }
    public void setLastVisitAt(Instant lastVisitAt) { this.lastVisitAt = lastVisitAt; }
}
