package com.assetvault.upload.gateway;

import com.assetvault.upload.entity.FailureReason;

import java.util.UUID;

public record UploadFailureSummary(
        UUID uploadSessionId,
        UUID tenantId,
        int failureCount,
        FailureReason failureReason,
        String message
) {
}
