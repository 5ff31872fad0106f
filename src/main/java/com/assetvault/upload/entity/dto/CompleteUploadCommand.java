package com.assetvault.upload.entity.dto;

import java.util.Map;
import java.util.UUID;

/**
 * Client-declared labels for the asset. Size, content type and location are never
 * taken from here; they come from the object store.
 */
public record CompleteUploadCommand(
        String fileName,
        String title,
        UUID categoryId,
        Map<String, Object> metadata
) {
    public CompleteUploadCommand {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static CompleteUploadCommand empty() {
        return new CompleteUploadCommand(null, null, null, Map.of());
    }
}
