package com.assetvault.upload.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable asset produced by a completed upload session.
 *
 * <p>{@code upload_session_id} is covered by a partial unique index
 * ({@code WHERE deleted_at IS NULL}), which is what keeps completion to one asset per session.
 */
@Entity
@Table(name = "assets")
@Data
public class Asset {
    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID tenantId;
    private UUID brandId;

    @Column(nullable = false)
    private UUID uploadSessionId;
    @Column(nullable = false)
    private UUID storageBucketId;
    @Column(nullable = false)
    private String storagePath;

    private String originalFilename;
    private String title;
    private String mimeType;
    private long sizeBytes;

    @Enumerated(EnumType.STRING)
    private AssetType type;

    private UUID categoryId;
    @Enumerated(EnumType.STRING)
    private AssetClassification classification;

    private boolean published;
    @Enumerated(EnumType.STRING)
    private ApprovalStatus approvalStatus = ApprovalStatus.NOT_REQUIRED;
    private UUID publishedBy;
    private Instant publishedAt;

    private UUID createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
