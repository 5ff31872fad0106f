package com.assetvault.upload.entity.dto;

import java.util.UUID;

public record MultipartInitiation(
        UUID uploadSessionId,
        String multipartUploadId,
        long partSize,
        int totalParts,
        boolean alreadyInitiated
) {
}
