package com.assetvault.upload.storage;

import com.assetvault.upload.exception.RemoteUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedUploadPartRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class S3ObjectStoreGateway implements ObjectStoreGateway {

    private static final String NO_SUCH_UPLOAD = "NoSuchUpload";

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;

    @Override
    public ObjectStat stat(String bucket, String key) {
        try {
            HeadObjectResponse head = s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            long size = head.contentLength() != null ? head.contentLength() : 0L;
            return ObjectStat.of(size, head.contentType());
        } catch (NoSuchKeyException e) {
            log.debug("Object not found: bucket={}, key={}", bucket, key);
            return ObjectStat.missing();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                log.debug("Object not found: bucket={}, key={}", bucket, key);
                return ObjectStat.missing();
            }
            throw new RemoteUnavailableException("headObject", e);
        } catch (SdkException e) {
            throw new RemoteUnavailableException("headObject", e);
        }
    }

    @Override
    public String presignPut(String bucket, String key, String contentType, Duration ttl) {
        try {
            PutObjectRequest.Builder put = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key);
            if (contentType != null && !contentType.isBlank()) {
                put.contentType(contentType);
            }
            PresignedPutObjectRequest presigned = s3Presigner.presignPutObject(builder -> builder
                    .signatureDuration(ttl)
                    .putObjectRequest(put.build()));
            log.debug("Generated presigned upload URL for key: {}, expires in {} minutes", key, ttl.toMinutes());
            return presigned.url().toString();
        } catch (SdkException e) {
            throw new RemoteUnavailableException("presignPutObject", e);
        }
    }

    @Override
    public String presignPart(String bucket, String key, String transferId, int partNumber, Duration ttl) {
        try {
            UploadPartRequest part = UploadPartRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .uploadId(transferId)
                    .partNumber(partNumber)
                    .build();
            PresignedUploadPartRequest presigned = s3Presigner.presignUploadPart(builder -> builder
                    .signatureDuration(ttl)
                    .uploadPartRequest(part));
            return presigned.url().toString();
        } catch (SdkException e) {
            throw new RemoteUnavailableException("presignUploadPart", e);
        }
    }

    @Override
    public String initiateMultipart(String bucket, String key, String contentType) {
        try {
            CreateMultipartUploadRequest.Builder request = CreateMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(key);
            if (contentType != null && !contentType.isBlank()) {
                request.contentType(contentType);
            }
            String uploadId = s3Client.createMultipartUpload(request.build()).uploadId();
            log.debug("Initiated multipart upload: bucket={}, key={}, uploadId={}", bucket, key, uploadId);
            return uploadId;
        } catch (SdkException e) {
            throw new RemoteUnavailableException("createMultipartUpload", e);
        }
    }

    @Override
    public List<UploadedPart> listParts(String bucket, String key, String transferId) {
        try {
            List<UploadedPart> parts = new ArrayList<>();
            s3Client.listPartsPaginator(ListPartsRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .uploadId(transferId)
                            .build())
                    .parts()
                    .forEach(p -> parts.add(new UploadedPart(p.partNumber(), p.eTag(),
                            p.size() != null ? p.size() : 0L)));
            return parts;
        } catch (SdkException e) {
            throw translate("listParts", transferId, e);
        }
    }

    @Override
    public void completeMultipart(String bucket, String key, String transferId, List<UploadedPart> orderedParts) {
        List<CompletedPart> completed = orderedParts.stream()
                .map(p -> CompletedPart.builder()
                        .partNumber(p.partNumber())
                        .eTag(p.checksum())
                        .build())
                .toList();
        try {
            s3Client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .uploadId(transferId)
                    .multipartUpload(CompletedMultipartUpload.builder().parts(completed).build())
                    .build());
            log.debug("Completed multipart upload: bucket={}, key={}, parts={}", bucket, key, completed.size());
        } catch (SdkException e) {
            throw translate("completeMultipartUpload", transferId, e);
        }
    }

    @Override
    public void abortMultipart(String bucket, String key, String transferId) {
        try {
            s3Client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .uploadId(transferId)
                    .build());
            log.debug("Aborted multipart upload: bucket={}, key={}, uploadId={}", bucket, key, transferId);
        } catch (SdkException e) {
            throw translate("abortMultipartUpload", transferId, e);
        }
    }

    @Override
    public void deleteObject(String bucket, String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            log.debug("Deleted S3 object: bucket={}, key={}", bucket, key);
        } catch (SdkException e) {
            throw new RemoteUnavailableException("deleteObject", e);
        }
    }

    @Override
    public boolean bucketExists(String bucket) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new RemoteUnavailableException("headBucket", e);
        } catch (SdkException e) {
            throw new RemoteUnavailableException("headBucket", e);
        }
    }

    @Override
    public void createBucket(String bucket) {
        try {
            s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
            log.info("Created storage bucket: {}", bucket);
        } catch (BucketAlreadyOwnedByYouException e) {
            log.debug("Bucket already exists and is owned by us: {}", bucket);
        } catch (SdkException e) {
            throw new RemoteUnavailableException("createBucket", e);
        }
    }

    private RuntimeException translate(String operation, String transferId, SdkException e) {
        if (e instanceof NoSuchUploadException) {
            return new TransferNotFoundException(transferId, e);
        }
        if (e instanceof S3Exception s3) {
            String code = s3.awsErrorDetails() != null ? s3.awsErrorDetails().errorCode() : null;
            if (NO_SUCH_UPLOAD.equals(code)) {
                return new TransferNotFoundException(transferId, e);
            }
            if (s3.statusCode() >= 400 && s3.statusCode() < 500) {
                return new ObjectStoreRejectedException(operation + " rejected: " + s3.getMessage(), s3.statusCode(), e);
            }
        }
        return new RemoteUnavailableException(operation, e);
    }
}
