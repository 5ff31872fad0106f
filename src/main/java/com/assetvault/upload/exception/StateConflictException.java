package com.assetvault.upload.exception;

import com.assetvault.upload.entity.UploadStatus;

import java.util.UUID;

public class StateConflictException extends UploadException {

    private final UploadStatus currentStatus;
    private final UploadStatus targetStatus;

    public StateConflictException(UUID uploadSessionId, UploadStatus currentStatus, UploadStatus targetStatus) {
        super(ErrorCode.STATE_CONFLICT, false,
                "Upload session " + uploadSessionId + " cannot move from " + currentStatus + " to " + targetStatus);
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public UploadStatus getCurrentStatus() {
        return currentStatus;
    }

    public UploadStatus getTargetStatus() {
        return targetStatus;
    }
}
