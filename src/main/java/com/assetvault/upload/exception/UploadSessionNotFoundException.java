package com.assetvault.upload.exception;

import java.util.UUID;

public class UploadSessionNotFoundException extends UploadException {

    public UploadSessionNotFoundException(UUID uploadSessionId) {
        super(ErrorCode.NOT_FOUND, false, "Upload session not found: " + uploadSessionId);
    }
}
