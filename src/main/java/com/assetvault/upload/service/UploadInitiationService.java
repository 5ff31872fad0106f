package com.assetvault.upload.service;

import com.assetvault.upload.config.UploadProperties;
import com.assetvault.upload.entity.StorageBucket;
import com.assetvault.upload.entity.UploadMode;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.UploadType;
import com.assetvault.upload.entity.dto.BatchItemResult;
import com.assetvault.upload.entity.dto.InitiateUploadCommand;
import com.assetvault.upload.entity.dto.InitiationResult;
import com.assetvault.upload.entity.dto.UploadContext;
import com.assetvault.upload.entity.dto.UploadGrant;
import com.assetvault.upload.exception.AssetNotFoundException;
import com.assetvault.upload.exception.ErrorCode;
import com.assetvault.upload.exception.InvalidUploadRequestException;
import com.assetvault.upload.exception.PlanLimitExceededException;
import com.assetvault.upload.exception.UploadException;
import com.assetvault.upload.gateway.PlanDecision;
import com.assetvault.upload.gateway.PlanLimitGate;
import com.assetvault.upload.repo.AssetRepository;
import com.assetvault.upload.storage.ObjectStoreGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Opens upload sessions and hands out the grants clients transfer bytes with.
 *
 * <p>The plan check runs before anything is written or signed. Each session is opened
 * in its own transaction, so files of one batch never roll each other back.
 */
@Slf4j
@Service
public class UploadInitiationService {

    static final String BUCKET_UNAVAILABLE = "Storage bucket unavailable.";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final PlanLimitGate planLimitGate;
    private final TenantBucketService bucketService;
    private final UploadSessionStore sessionStore;
    private final ObjectStoreGateway objectStore;
    private final AssetRepository assets;
    private final UploadProperties properties;
    private final Executor batchExecutor;
    private final Clock clock;

    public UploadInitiationService(
            PlanLimitGate planLimitGate,
            TenantBucketService bucketService,
            UploadSessionStore sessionStore,
            ObjectStoreGateway objectStore,
            AssetRepository assets,
            UploadProperties properties,
            @Qualifier("uploadBatchExecutor") Executor batchExecutor,
            Clock clock
    ) {
        this.planLimitGate = planLimitGate;
        this.bucketService = bucketService;
        this.sessionStore = sessionStore;
        this.objectStore = objectStore;
        this.assets = assets;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    public InitiationResult initiate(UploadContext context, InitiateUploadCommand command) {
        validate(command);
        checkPlan(context.tenantId(), command.fileSize());
        StorageBucket bucket = bucketService.resolve(context.tenantId());
        return open(context, command, bucket, null, UploadMode.CREATE, null);
    }

    /**
     * Starts an upload whose result replaces the file of an existing asset.
     */
    public InitiationResult initiateReplace(UploadContext context, UUID assetId, InitiateUploadCommand command) {
        context.requireBrandId();
        validate(command);
        assets.findByIdAndTenantIdAndDeletedAtIsNull(assetId, context.tenantId())
                .orElseThrow(() -> new AssetNotFoundException(assetId));
        checkPlan(context.tenantId(), command.fileSize());
        StorageBucket bucket = bucketService.resolve(context.tenantId());
        return open(context, command, bucket, null, UploadMode.REPLACE, assetId);
    }

    /**
     * Initiates every file independently. The returned list follows the input order; each
     * entry carries either a result or the error that stopped that file alone.
     */
    public List<BatchItemResult> initiateBatch(UploadContext context, List<InitiateUploadCommand> commands) {
        if (commands == null || commands.isEmpty()) {
            throw new InvalidUploadRequestException("At least one file is required");
        }
        if (commands.size() > properties.maxBatchSize()) {
            throw new InvalidUploadRequestException("Batch of " + commands.size()
                    + " files exceeds the limit of " + properties.maxBatchSize());
        }
        String batchReference = UUID.randomUUID().toString();

        StorageBucket bucket;
        try {
            bucket = bucketService.resolve(context.tenantId());
        } catch (UploadException e) {
            log.warn("Batch upload initiation failed to resolve bucket: tenantId={}, batchReference={}, error={}",
                    context.tenantId(), batchReference, e.getMessage());
            return commands.stream()
                    .map(c -> BatchItemResult.failure(c.clientReference(), batchReference,
                            e.getCode(), BUCKET_UNAVAILABLE, e.isRetryable()))
                    .toList();
        }

        List<CompletableFuture<BatchItemResult>> futures = commands.stream()
                .map(c -> submitItem(context, c, bucket, batchReference))
                .toList();
        List<BatchItemResult> results = futures.stream().map(CompletableFuture::join).toList();

        long failed = results.stream().filter(r -> !r.succeeded()).count();
        log.info("Batch upload initiation finished: tenantId={}, batchReference={}, files={}, failed={}",
                context.tenantId(), batchReference, results.size(), failed);
        return results;
    }

    private CompletableFuture<BatchItemResult> submitItem(UploadContext context, InitiateUploadCommand command,
                                                          StorageBucket bucket, String batchReference) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> initiateItem(context, command, bucket, batchReference), batchExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Batch item not scheduled: batchReference={}, clientReference={}, error={}",
                    batchReference, command.clientReference(), e.getMessage());
            return CompletableFuture.completedFuture(BatchItemResult.failure(command.clientReference(),
                    batchReference, ErrorCode.INTERNAL_ERROR, "Failed to initiate upload", true));
        }
    }

    private BatchItemResult initiateItem(UploadContext context, InitiateUploadCommand command,
                                         StorageBucket bucket, String batchReference) {
        try {
            validate(command);
            checkPlan(context.tenantId(), command.fileSize());
            return BatchItemResult.success(
                    open(context, command, bucket, batchReference, UploadMode.CREATE, null));
        } catch (UploadException e) {
            log.info("Batch item rejected: batchReference={}, clientReference={}, error={}",
                    batchReference, command.clientReference(), e.getMessage());
            return BatchItemResult.failure(command.clientReference(), batchReference,
                    e.getCode(), e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            log.error("Batch item failed: batchReference={}, clientReference={}",
                    batchReference, command.clientReference(), e);
            return BatchItemResult.failure(command.clientReference(), batchReference,
                    ErrorCode.INTERNAL_ERROR, "Failed to initiate upload", true);
        }
    }

    private InitiationResult open(UploadContext context, InitiateUploadCommand command, StorageBucket bucket,
                                  String batchReference, UploadMode mode, UUID targetAssetId) {
        Instant now = Instant.now(clock);
        UploadSession session = new UploadSession();
        session.setId(UUID.randomUUID());
        session.setTenantId(context.tenantId());
        session.setBrandId(context.brandId());
        session.setClientReference(command.clientReference());
        session.setBatchReference(batchReference);
        session.setStorageBucketId(bucket.getId());
        session.setOriginalFilename(command.fileName());
        session.setMimeType(command.mimeType());
        session.setType(transferType(command.fileSize()));
        session.setMode(mode);
        session.setAssetId(targetAssetId);
        session.setExpectedSize(command.fileSize());
        session.setStatus(UploadStatus.INITIATING);
        session.setExpiresAt(now.plus(properties.sessionTtl()));
        session.setLastActivityAt(now);

        UploadGrant grant = sessionStore.open(session, s -> issueGrant(s, bucket.getName()));

        log.info("Upload session created: uploadSessionId={}, tenantId={}, type={}, mode={}, size={}, clientReference={}",
                session.getId(), session.getTenantId(), session.getType(), mode,
                command.fileSize(), command.clientReference());
        return InitiationResult.of(session, grant);
    }

    UploadType transferType(long sizeBytes) {
        return sizeBytes > properties.multipartThresholdBytes() ? UploadType.CHUNKED : UploadType.DIRECT;
    }

    private UploadGrant issueGrant(UploadSession session, String bucketName) {
        String contentType = contentType(session.getMimeType());
        if (session.getType() == UploadType.DIRECT) {
            return UploadGrant.direct(objectStore.presignPut(
                    bucketName, session.objectKey(), contentType, properties.presignedUrlTtl()));
        }
        String transferId = properties.eagerMultipartInitiation()
                ? objectStore.initiateMultipart(bucketName, session.objectKey(), contentType)
                : null;
        return UploadGrant.chunked(transferId, properties.chunkSizeBytes());
    }

    private void checkPlan(UUID tenantId, long sizeBytes) {
        PlanDecision decision = planLimitGate.checkUploadAllowed(tenantId, sizeBytes);
        if (decision instanceof PlanDecision.LimitExceeded exceeded) {
            log.info("Upload rejected by plan limit: tenantId={}, size={}, limit={}",
                    tenantId, sizeBytes, exceeded.limitBytes());
            throw new PlanLimitExceededException(tenantId, sizeBytes, exceeded.limitBytes());
        }
    }

    private static void validate(InitiateUploadCommand command) {
        if (command.fileName() == null || command.fileName().isBlank()) {
            throw new InvalidUploadRequestException("fileName is required");
        }
        if (command.fileSize() <= 0) {
            throw new InvalidUploadRequestException("fileSize must be positive");
        }
    }

    static String contentType(String mimeType) {
        return mimeType == null || mimeType.isBlank() ? DEFAULT_CONTENT_TYPE : mimeType;
    }
}
