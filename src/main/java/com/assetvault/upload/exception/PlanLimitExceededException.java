package com.assetvault.upload.exception;

import java.util.UUID;

public class PlanLimitExceededException extends UploadException {

    private final long requestedBytes;
    private final long limitBytes;

    public PlanLimitExceededException(UUID tenantId, long requestedBytes, long limitBytes) {
        super(ErrorCode.PLAN_LIMIT_EXCEEDED, false,
                "File size (" + requestedBytes + " bytes) exceeds maximum upload size ("
                        + limitBytes + " bytes) for tenant " + tenantId);
        this.requestedBytes = requestedBytes;
        this.limitBytes = limitBytes;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
