package com.assetvault.upload.service;

import com.assetvault.upload.config.UploadProperties;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.UploadType;
import com.assetvault.upload.entity.dto.MultipartInitiation;
import com.assetvault.upload.entity.dto.PartUploadUrl;
import com.assetvault.upload.entity.dto.UploadContext;
import com.assetvault.upload.exception.BucketNotReadyException;
import com.assetvault.upload.exception.InvalidUploadRequestException;
import com.assetvault.upload.exception.StateConflictException;
import com.assetvault.upload.storage.ObjectStoreGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Client-facing steps of a chunked upload: starting the remote transfer and signing
 * one URL per part.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultipartUploadService {

    private final UploadSessionStore sessionStore;
    private final TenantBucketService bucketService;
    private final ObjectStoreGateway objectStore;
    private final UploadProperties properties;
    private final Clock clock;

    /**
     * Returns the session's multipart transfer, starting it on the store if needed.
     * Repeated calls return the same transfer id.
     */
    public MultipartInitiation initiateMultipart(UploadContext context, UUID sessionId) {
        UploadSession session = requireOpenChunked(context, sessionId);
        long partSize = properties.chunkSizeBytes();
        int totalParts = totalParts(session.getExpectedSize(), partSize);

        if (session.getMultipartUploadId() != null) {
            return new MultipartInitiation(sessionId, session.getMultipartUploadId(), partSize, totalParts, true);
        }

        String bucket = bucketName(session);
        String transferId = objectStore.initiateMultipart(bucket, session.objectKey(),
                UploadInitiationService.contentType(session.getMimeType()));
        UploadSession updated = sessionStore.attachMultipartUploadId(sessionId, transferId);

        if (!transferId.equals(updated.getMultipartUploadId())) {
            // lost the race to a concurrent call, drop our transfer
            try {
                objectStore.abortMultipart(bucket, session.objectKey(), transferId);
            } catch (RuntimeException e) {
                log.warn("Failed to abort duplicate multipart upload: uploadSessionId={}, multipartUploadId={}, error={}",
                        sessionId, transferId, e.getMessage());
            }
            return new MultipartInitiation(sessionId, updated.getMultipartUploadId(), partSize, totalParts, true);
        }

        log.info("[Upload Lifecycle] Multipart upload initiated: uploadSessionId={}, multipartUploadId={}, totalParts={}",
                sessionId, transferId, totalParts);
        return new MultipartInitiation(sessionId, transferId, partSize, totalParts, false);
    }

    public PartUploadUrl signPartUrl(UploadContext context, UUID sessionId, int partNumber) {
        UploadSession session = requireOpenChunked(context, sessionId);
        if (session.getMultipartUploadId() == null) {
            throw new InvalidUploadRequestException("Multipart upload has not been initiated for session " + sessionId);
        }
        int totalParts = totalParts(session.getExpectedSize(), properties.chunkSizeBytes());
        if (partNumber < 1 || partNumber > totalParts) {
            throw new InvalidUploadRequestException(
                    "partNumber must be between 1 and " + totalParts + ", got " + partNumber);
        }
        String url = objectStore.presignPart(bucketName(session), session.objectKey(),
                session.getMultipartUploadId(), partNumber, properties.partUrlTtl());
        return new PartUploadUrl(partNumber, url, Instant.now(clock).plus(properties.partUrlTtl()));
    }

    static int totalParts(long expectedSize, long partSize) {
        return Math.toIntExact((expectedSize + partSize - 1) / partSize);
    }

    private UploadSession requireOpenChunked(UploadContext context, UUID sessionId) {
        UploadSession session = sessionStore.load(sessionId, context.tenantId());
        if (session.getType() != UploadType.CHUNKED) {
            throw new InvalidUploadRequestException("Upload session " + sessionId + " is not a chunked upload");
        }
        if (session.isTerminal()) {
            throw new StateConflictException(sessionId, session.getStatus(), UploadStatus.UPLOADING);
        }
        return session;
    }

    private String bucketName(UploadSession session) {
        return bucketService.findBucketName(session.getStorageBucketId())
                .orElseThrow(() -> new BucketNotReadyException(session.getTenantId(), "bucket record is missing"));
    }
}
