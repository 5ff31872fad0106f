package com.assetvault.upload.storage;

public record UploadedPart(int partNumber, String checksum, long sizeBytes) {
}
