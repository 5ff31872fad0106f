package com.assetvault.upload.entity.dto;

import com.assetvault.upload.entity.UploadStatus;

import java.util.UUID;

/**
 * @param transitioned false when the call was a no-op (already in, or past, the target state)
 */
public record TransitionOutcome(UUID uploadSessionId, UploadStatus status, boolean transitioned) {
}
