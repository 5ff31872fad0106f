package com.assetvault.upload.entity;

import java.util.Objects;
import java.util.UUID;

/**
 * Object-store paths for in-flight uploads.
 *
 * <p>The temporary key depends on the session id only, so any component holding the id
 * (cleanup, completion, multipart assembly) derives the same key. The format is fixed.
 */
public final class ObjectKeys {

    private static final String TEMP_UPLOAD_PREFIX = "temp/uploads/";

    private ObjectKeys() {
    }

    public static String tempUploadKey(UUID uploadSessionId) {
        Objects.requireNonNull(uploadSessionId, "uploadSessionId");
        return TEMP_UPLOAD_PREFIX + uploadSessionId + "/original";
    }
}
