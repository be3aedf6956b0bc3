package io.github.drompincen.carebridge.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Relational-side user account. Owned by the dashboard application; the sync engine only reads it.
 */
@Entity
@Table(name = "users")
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true)
    private String email;

    @Column(name = "external_uuid", unique = true, length = 64)
    private String externalUuid;

    @Column(length = 50)
    private String role;

    public UserEntity() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getExternalUuid() { return externalUuid; }
    public void setExternalUuid(String externalUuid) { this.externalUuid = externalUuid; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }
}
