package com.assetvault.upload.entity.dto;

import com.assetvault.upload.exception.InvalidUploadRequestException;

import java.util.Objects;
import java.util.UUID;

/**
 * Caller identity threaded through every upload operation. Nothing in the upload
 * lifecycle looks the tenant or brand up from ambient state.
 */
public record UploadContext(UUID tenantId, UUID brandId, UUID userId) {

    public UploadContext {
        Objects.requireNonNull(tenantId, "tenantId is required");
    }

    public UUID requireBrandId() {
        if (brandId == null) {
            throw new InvalidUploadRequestException("brandId is required for this operation");
        }
        return brandId;
    }
}
