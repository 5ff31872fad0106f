package com.assetvault.upload.entity.dto;

import java.time.Instant;

public record PartUploadUrl(int partNumber, String uploadUrl, Instant expiresAt) {
}
