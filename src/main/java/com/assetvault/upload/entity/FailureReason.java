package com.assetvault.upload.entity;

public enum FailureReason {
    CANCELLED_BY_USER,
    EXPIRED,
    SIZE_MISMATCH,
    OBJECT_MISSING,
    ASSEMBLY_FAILED,
    METADATA_REJECTED,
    REMOTE_UNAVAILABLE,
    UNKNOWN
}
