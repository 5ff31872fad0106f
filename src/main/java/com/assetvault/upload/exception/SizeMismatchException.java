package com.assetvault.upload.exception;

import java.util.UUID;

public class SizeMismatchException extends UploadException {

    private final long expectedSize;
    private final long observedSize;

    public SizeMismatchException(UUID uploadSessionId, long expectedSize, long observedSize) {
        super(ErrorCode.SIZE_MISMATCH, false,
                "Uploaded object for session " + uploadSessionId + " has " + observedSize
                        + " bytes, expected " + expectedSize);
        this.expectedSize = expectedSize;
        this.observedSize = observedSize;
    }

    public long getExpectedSize() {
        return expectedSize;
    }

    public long getObservedSize() {
        return observedSize;
    }
}
