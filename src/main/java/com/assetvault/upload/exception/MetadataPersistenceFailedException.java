package com.assetvault.upload.exception;

import java.util.List;
import java.util.UUID;

public class MetadataPersistenceFailedException extends UploadException {

    private final List<String> rejectedFields;

    public MetadataPersistenceFailedException(UUID uploadSessionId, List<String> rejectedFields) {
        super(ErrorCode.METADATA_PERSISTENCE_FAILED, false,
                "None of the supplied metadata fields were accepted for session " + uploadSessionId
                        + ": " + rejectedFields);
        this.rejectedFields = List.copyOf(rejectedFields);
    }

    public List<String> getRejectedFields() {
        return rejectedFields;
    }
}
