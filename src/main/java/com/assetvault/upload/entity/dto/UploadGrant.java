package com.assetvault.upload.entity.dto;

/**
 * What the client needs to start transferring bytes. Direct uploads get a URL,
 * chunked uploads get a chunk size and, once initiated, a multipart transfer id.
 */
public record UploadGrant(String uploadUrl, String multipartUploadId, Long chunkSize) {

    public static UploadGrant direct(String uploadUrl) {
        return new UploadGrant(uploadUrl, null, null);
    }

    public static UploadGrant chunked(String multipartUploadId, long chunkSize) {
        return new UploadGrant(null, multipartUploadId, chunkSize);
    }
}
