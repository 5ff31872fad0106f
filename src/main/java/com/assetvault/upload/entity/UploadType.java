package com.assetvault.upload.entity;

public enum UploadType {
    DIRECT,
    CHUNKED
}
