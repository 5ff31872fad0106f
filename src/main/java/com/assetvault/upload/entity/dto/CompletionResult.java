package com.assetvault.upload.entity.dto;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.UploadStatus;

import java.util.List;
import java.util.UUID;

/**
 * @param alreadyCompleted true when this call found the asset made by an earlier call
 * @param rejectedMetadataFields keys the category schema did not accept (warning only)
 */
public record CompletionResult(
        UUID uploadSessionId,
        UploadStatus sessionStatus,
        Asset asset,
        boolean alreadyCompleted,
        List<String> rejectedMetadataFields
) {
    public CompletionResult {
        rejectedMetadataFields = rejectedMetadataFields == null ? List.of() : List.copyOf(rejectedMetadataFields);
    }
}
