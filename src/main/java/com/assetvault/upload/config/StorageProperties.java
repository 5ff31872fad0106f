package com.assetvault.upload.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
        String bucketPrefix,
        boolean autoProvision,
        S3Properties s3
) {
    public record S3Properties(
            String region,
            String endpoint,
            boolean pathStyleAccess,
            String accessKeyId,
            String secretAccessKey,
            Duration connectionTimeout,
            Duration socketTimeout,
            Duration apiCallTimeout
    ) {
        public S3Properties {
            if (region == null || region.isBlank()) {
                region = "us-east-1";
            }
            if (connectionTimeout == null) {
                connectionTimeout = Duration.ofSeconds(10);
            }
            if (socketTimeout == null) {
                socketTimeout = Duration.ofSeconds(30);
            }
            if (apiCallTimeout == null) {
                apiCallTimeout = Duration.ofSeconds(60);
            }
        }
    }

    public StorageProperties {
        if (bucketPrefix == null || bucketPrefix.isBlank()) {
            bucketPrefix = "assetvault-tenant-";
        }
        if (s3 == null) {
            s3 = new S3Properties(null, null, false, null, null, null, null, null);
        }
    }
}
