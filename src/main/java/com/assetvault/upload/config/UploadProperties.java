package com.assetvault.upload.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.upload")
public record UploadProperties(
        long multipartThresholdBytes,
        long chunkSizeBytes,
        Duration sessionTtl,
        Duration presignedUrlTtl,
        Duration partUrlTtl,
        int maxBatchSize,
        int batchParallelism,
        boolean eagerMultipartInitiation,
        int escalationThreshold,
        long defaultMaxUploadBytes
) {
    private static final long MB = 1024L * 1024L;

    public UploadProperties {
        if (multipartThresholdBytes <= 0) {
            multipartThresholdBytes = 100 * MB;
        }
        if (chunkSizeBytes <= 0) {
            chunkSizeBytes = 10 * MB;
        }
        if (sessionTtl == null || sessionTtl.isZero() || sessionTtl.isNegative()) {
            sessionTtl = Duration.ofMinutes(60);
        }
        if (presignedUrlTtl == null || presignedUrlTtl.isZero() || presignedUrlTtl.isNegative()) {
            presignedUrlTtl = Duration.ofMinutes(60);
        }
        if (partUrlTtl == null || partUrlTtl.isZero() || partUrlTtl.isNegative()) {
            partUrlTtl = Duration.ofMinutes(15);
        }
        if (maxBatchSize <= 0) {
            maxBatchSize = 100;
        }
        if (batchParallelism <= 0) {
            batchParallelism = 8;
        }
        if (escalationThreshold <= 0) {
            escalationThreshold = 3;
        }
        if (defaultMaxUploadBytes <= 0) {
            defaultMaxUploadBytes = 5L * 1024 * MB;
        }
    }

    public static UploadProperties defaults() {
        return new UploadProperties(0, 0, null, null, null, 0, 0, true, 0, 0);
    }
}
