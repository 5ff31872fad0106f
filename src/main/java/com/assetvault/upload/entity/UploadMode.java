package com.assetvault.upload.entity;

public enum UploadMode {
    /** Produces a new asset. */
    CREATE,
    /** Overwrites the file of an existing asset, leaving its metadata alone. */
    REPLACE
}
