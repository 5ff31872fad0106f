package com.assetvault.upload.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * S3 client and presigner. Supports a custom endpoint for MinIO/LocalStack.
 * Every call is bounded by the connect, socket and whole-call timeouts.
 */
@Configuration
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(StorageProperties properties) {
        var s3Props = properties.s3();

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3Props.region()))
                .credentialsProvider(credentials(s3Props))
                .httpClientBuilder(ApacheHttpClient.builder()
                        .connectionTimeout(s3Props.connectionTimeout())
                        .socketTimeout(s3Props.socketTimeout()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(s3Props.apiCallTimeout())
                        .build());

        if (s3Props.endpoint() != null && !s3Props.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3Props.endpoint()))
                    .forcePathStyle(s3Props.pathStyleAccess());
        }

        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner(StorageProperties properties) {
        var s3Props = properties.s3();

        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(s3Props.region()))
                .credentialsProvider(credentials(s3Props))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(s3Props.pathStyleAccess())
                        .build());

        if (s3Props.endpoint() != null && !s3Props.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3Props.endpoint()));
        }

        return builder.build();
    }

    // Explicit keys when configured, otherwise env vars, ~/.aws/credentials or an IAM role
    private AwsCredentialsProvider credentials(StorageProperties.S3Properties s3Props) {
        if (s3Props.accessKeyId() != null && !s3Props.accessKeyId().isBlank()
                && s3Props.secretAccessKey() != null && !s3Props.secretAccessKey().isBlank()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3Props.accessKeyId(), s3Props.secretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
