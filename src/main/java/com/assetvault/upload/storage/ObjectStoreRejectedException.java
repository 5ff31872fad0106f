package com.assetvault.upload.storage;

/**
 * The store answered but refused the request (a 4xx other than a missing transfer).
 * Retrying the same request will not help.
 */
public class ObjectStoreRejectedException extends RuntimeException {

    private final int statusCode;

    public ObjectStoreRejectedException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
