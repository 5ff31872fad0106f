package com.assetvault.upload.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an upload session.
 *
 * <pre>
 * INITIATING -> UPLOADING -> COMPLETED
 * INITIATING | UPLOADING -> CANCELLED | FAILED | EXPIRED
 * </pre>
 */
public enum UploadStatus {
    INITIATING,
    UPLOADING,
    COMPLETED,
    CANCELLED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED || this == EXPIRED;
    }

    public boolean canTransitionTo(UploadStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<UploadStatus> allowedTargets() {
        return switch (this) {
            case INITIATING -> EnumSet.of(UPLOADING, CANCELLED, FAILED, EXPIRED);
            case UPLOADING -> EnumSet.of(COMPLETED, CANCELLED, FAILED, EXPIRED);
            default -> EnumSet.noneOf(UploadStatus.class);
        };
    }
}
