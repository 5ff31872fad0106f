package com.assetvault.upload.entity.dto;

import com.assetvault.upload.exception.ErrorCode;

/**
 * Per-file outcome of a batch initiation: exactly one of {@code result} and
 * {@code errorCode} is set.
 */
public record BatchItemResult(
        String clientReference,
        String batchReference,
        InitiationResult result,
        ErrorCode errorCode,
        String error,
        boolean retryable
) {
    public static BatchItemResult success(InitiationResult result) {
        return new BatchItemResult(result.clientReference(), result.batchReference(), result, null, null, false);
    }

    public static BatchItemResult failure(String clientReference, String batchReference,
                                          ErrorCode errorCode, String error, boolean retryable) {
        return new BatchItemResult(clientReference, batchReference, null, errorCode, error, retryable);
    }

    public boolean succeeded() {
        return result != null;
    }
}
