package com.assetvault.upload.exception;

/**
 * Base of every failure the upload lifecycle reports to its callers.
 */
public abstract class UploadException extends RuntimeException {

    private final ErrorCode code;
    private final boolean retryable;

    protected UploadException(ErrorCode code, boolean retryable, String message) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected UploadException(ErrorCode code, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public ErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
