package com.assetvault.upload.exception;

import java.util.UUID;

/**
 * Completion was requested before the object reached the store. The client may finish
 * its transfer and call completion again.
 */
public class UploadedObjectMissingException extends UploadException {

    public UploadedObjectMissingException(UUID uploadSessionId, String key) {
        super(ErrorCode.OBJECT_MISSING, true,
                "No uploaded object found for session " + uploadSessionId + " at " + key);
    }
}
