package com.assetvault.upload.entity.dto;

import java.util.UUID;

/**
 * @param targetAssetId set only when replacing the file of an existing asset
 */
public record InitiateUploadCommand(
        String fileName,
        long fileSize,
        String mimeType,
        String clientReference,
        UUID targetAssetId
) {
    public static InitiateUploadCommand create(String fileName, long fileSize, String mimeType, String clientReference) {
        return new InitiateUploadCommand(fileName, fileSize, mimeType, clientReference, null);
    }
}
