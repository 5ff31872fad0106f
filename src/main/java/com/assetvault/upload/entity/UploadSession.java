package com.assetvault.upload.entity;

import com.assetvault.upload.exception.StateConflictException;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * One upload attempt. A session produces at most one asset; the asset's
 * {@code upload_session_id} column points back here.
 */
@Entity
@Table(name = "upload_sessions")
@Data
public class UploadSession {
    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID tenantId;
    private UUID brandId;
    private String clientReference;
    private String batchReference;

    @Column(nullable = false)
    private UUID storageBucketId;

    private String originalFilename;
    private String mimeType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UploadType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UploadMode mode = UploadMode.CREATE;

    /** Replace target; set only in {@link UploadMode#REPLACE}. */
    private UUID assetId;

    @Column(nullable = false)
    private long expectedSize;
    private Long uploadedSize;
    private String multipartUploadId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UploadStatus status = UploadStatus.INITIATING;

    @Column(nullable = false)
    private Instant expiresAt;
    private Instant lastActivityAt;

    @Enumerated(EnumType.STRING)
    private FailureReason failureReason;
    private int failureCount;
    private String ticketReference;
    private Instant lastCleanupAttemptAt;

    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * A move is legal when the current status allows the target and the session
     * has not run past its expiry. Expiry itself is always reachable from a live state.
     */
    public boolean canTransitionTo(UploadStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        return target == UploadStatus.EXPIRED || !isExpiredAt(now);
    }

    public void transitionTo(UploadStatus target, Instant now) {
        if (!canTransitionTo(target, now)) {
            UploadStatus effective = !status.isTerminal() && isExpiredAt(now) ? UploadStatus.EXPIRED : status;
            throw new StateConflictException(id, effective, target);
        }
        status = target;
        lastActivityAt = now;
    }

    /**
     * Flags a live session whose expiry has passed. Returns true when the status changed.
     */
    public boolean expireIfDue(Instant now) {
        if (status.isTerminal() || !isExpiredAt(now)) {
            return false;
        }
        status = UploadStatus.EXPIRED;
        failureReason = FailureReason.EXPIRED;
        return true;
    }

    public String objectKey() {
        return ObjectKeys.tempUploadKey(id);
    }
}
