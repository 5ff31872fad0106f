package com.assetvault.upload.exception;

import java.util.UUID;

public class BucketNotReadyException extends UploadException {

    public BucketNotReadyException(UUID tenantId, String detail) {
        super(ErrorCode.BUCKET_NOT_READY, true,
                "Storage bucket for tenant " + tenantId + " is not ready: " + detail);
    }
}
