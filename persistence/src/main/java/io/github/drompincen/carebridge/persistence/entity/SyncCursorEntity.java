package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "sync_cursors")
public class SyncCursorEntity {

    @Id
    @Column(length = 100)
    private String name;

    @Column(name = "cursor_value", nullable = false, length = 1024)
    private String cursorValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SyncCursorEntity() {}

    public SyncCursorEntity(String name, String cursorValue, Instant updatedAt) {
        this.name = name;
        this.cursorValue = cursorValue;
        this.updatedAt = updatedAt;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCursorValue() { return cursorValue; }
    public void setCursorValue(String cursorValue) { this.cursorValue = cursorValue; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
