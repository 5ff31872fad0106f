package com.assetvault.upload.exception;

public enum ErrorCode {
    PLAN_LIMIT_EXCEEDED,
    BUCKET_NOT_READY,
    STATE_CONFLICT,
    SIZE_MISMATCH,
    TRANSFER_ASSEMBLY_FAILED,
    OBJECT_MISSING,
    METADATA_PERSISTENCE_FAILED,
    REMOTE_UNAVAILABLE,
    NOT_FOUND,
    INVALID_REQUEST,
    INTERNAL_ERROR
}
