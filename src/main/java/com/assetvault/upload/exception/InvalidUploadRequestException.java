package com.assetvault.upload.exception;

public class InvalidUploadRequestException extends UploadException {

    public InvalidUploadRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, false, message);
    }
}
