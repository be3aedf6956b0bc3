package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Version;

import java.time.Instant;

/**
 * Columns shared by every table mirrored from the document store.
 *
 * <p>{@code couchId} is the natural key. {@code couchUpdatedAt} is the business time of the last
 * applied version and is the ordering signal used for conflict resolution; it never moves backwards.
 * {@code actorUserId} is backed by a foreign key to {@code users}.
 */
@MappedSuperclass
public abstract class MirroredEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "couch_id", nullable = false, unique = true, updatable = false)
    private String couchId;

    @Column(name = "couch_rev", length = 100)
    private String couchRev;

    @Column(name = "couch_updated_at")
    private Instant couchUpdatedAt;

    @Column(name = "synced_at")
    private Instant syncedAt;

    @Lob
    @Column(name = "raw_document")
    private String rawDocument;

    @Column(name = "actor_user_id")
    private Long actorUserId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "actor_user_id", insertable = false, updatable = false)
    private UserEntity actor;

    @Column(name = "actor_role", length = 50)
    private String actorRole;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getCouchId() { return couchId; }
    public void setCouchId(String couchId) { this.couchId = couchId; }

    public String getCouchRev() { return couchRev; }
    public void setCouchRev(String couchRev) { this.couchRev = couchRev; }

    public Instant getCouchUpdatedAt() { return couchUpdatedAt; }
    public void setCouchUpdatedAt(Instant couchUpdatedAt) { this.couchUpdatedAt = couchUpdatedAt; }

    public Instant getSyncedAt() { return syncedAt; }
    public void setSyncedAt(Instant syncedAt) { this.syncedAt = syncedAt; }

    public String getRawDocument() { return rawDocument; }
    public void setRawDocument(String rawDocument) { this.rawDocument = rawDocument; }

    public Long getActorUserId() { return actorUserId; }
    public void setActorUserId(Long actorUserId) { this.actorUserId = actorUserId; }

    public UserEntity getActor() { return actor; }

    public String getActorRole() { return actorRole; }
    public void setActorRole(String actorRole) { this.actorRole = actorRole; }

    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }

    public long getVersion() { return version; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Hook for tables that carry their own active flag alongside the tombstone.
     */
    public void markDeleted() {
        this.deleted = true;
    }
}
