package com.assetvault.upload.entity.dto;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.UploadType;

import java.time.Instant;
import java.util.UUID;

public record InitiationResult(
        UUID uploadSessionId,
        String clientReference,
        String batchReference,
        UploadStatus status,
        UploadType uploadType,
        String uploadUrl,
        String multipartUploadId,
        Long chunkSize,
        Instant expiresAt
) {
    public static InitiationResult of(UploadSession session, UploadGrant grant) {
        return new InitiationResult(
                session.getId(),
                session.getClientReference(),
                session.getBatchReference(),
                session.getStatus(),
                session.getType(),
                grant.uploadUrl(),
                grant.multipartUploadId(),
                grant.chunkSize(),
                session.getExpiresAt());
    }
}
