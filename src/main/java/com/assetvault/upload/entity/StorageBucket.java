package com.assetvault.upload.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "storage_buckets")
@Data
public class StorageBucket {
    @Id
    private UUID id;

    @Column(nullable = false, unique = true)
    private UUID tenantId;

    @Column(nullable = false, unique = true)
    private String name;

    @Enumerated(EnumType.STRING)
    private Status status = Status.PROVISIONING;

    private Instant createdAt;
    private Instant updatedAt;

    public enum Status { PROVISIONING, ACTIVE, FAILED }

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
