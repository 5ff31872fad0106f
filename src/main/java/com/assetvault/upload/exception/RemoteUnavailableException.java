package com.assetvault.upload.exception;

public class RemoteUnavailableException extends UploadException {

    public RemoteUnavailableException(String operation, Throwable cause) {
        super(ErrorCode.REMOTE_UNAVAILABLE, true,
                "Object store call failed during " + operation + ": " + cause.getMessage(), cause);
    }
}
