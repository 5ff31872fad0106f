package com.assetvault.upload.service;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.Category;
import com.assetvault.upload.entity.FailureReason;
import com.assetvault.upload.entity.UploadMode;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.UploadType;
import com.assetvault.upload.entity.dto.CompleteUploadCommand;
import com.assetvault.upload.entity.dto.CompletionResult;
import com.assetvault.upload.entity.dto.UploadContext;
import com.assetvault.upload.event.AssetEventPublisher;
import com.assetvault.upload.exception.BucketNotReadyException;
import com.assetvault.upload.exception.InvalidUploadRequestException;
import com.assetvault.upload.exception.MetadataPersistenceFailedException;
import com.assetvault.upload.exception.RemoteUnavailableException;
import com.assetvault.upload.exception.SizeMismatchException;
import com.assetvault.upload.exception.StateConflictException;
import com.assetvault.upload.exception.TransferAssemblyFailedException;
import com.assetvault.upload.exception.UploadException;
import com.assetvault.upload.exception.UploadedObjectMissingException;
import com.assetvault.upload.gateway.MetadataFieldWriter;
import com.assetvault.upload.gateway.MetadataValidation;
import com.assetvault.upload.repo.AssetRepository;
import com.assetvault.upload.repo.CategoryRepository;
import com.assetvault.upload.storage.ObjectStat;
import com.assetvault.upload.storage.ObjectStoreGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a finished transfer into exactly one asset.
 *
 * <p>Safe to call any number of times, concurrently or not: a completed session returns
 * its asset, and concurrent callers converge on the single row the session lock and the
 * unique index on {@code upload_session_id} allow. Remote failures leave the session in
 * its current live state so the call can be retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadCompletionService {

    private static final MetadataValidation NO_METADATA = new MetadataValidation(Map.of(), List.of());

    private final UploadSessionStore sessionStore;
    private final TenantBucketService bucketService;
    private final ObjectStoreGateway objectStore;
    private final MultipartAssembler multipartAssembler;
    private final AssetMaterializer assetMaterializer;
    private final AssetPublicationService publicationService;
    private final MetadataFieldWriter metadataFieldWriter;
    private final UploadFailureRecorder failureRecorder;
    private final AssetEventPublisher eventPublisher;
    private final AssetRepository assets;
    private final CategoryRepository categories;
    private final Clock clock;

    public CompletionResult complete(UploadContext context, UUID sessionId, CompleteUploadCommand command) {
        return run(context, sessionId, command != null ? command : CompleteUploadCommand.empty(), UploadMode.CREATE);
    }

    /**
     * Completes a replace-mode session by pointing the target asset at the new file.
     * Title, category, metadata and publication state of the asset are left as they are.
     */
    public CompletionResult completeReplace(UploadContext context, UUID sessionId) {
        context.requireBrandId();
        return run(context, sessionId, CompleteUploadCommand.empty(), UploadMode.REPLACE);
    }

    private CompletionResult run(UploadContext context, UUID sessionId, CompleteUploadCommand command, UploadMode mode) {
        UploadSession session = sessionStore.load(sessionId, context.tenantId());
        if (session.getMode() != mode) {
            throw new InvalidUploadRequestException("Upload session " + sessionId + " is a "
                    + session.getMode() + " upload and cannot be completed as " + mode);
        }

        if (session.getStatus() == UploadStatus.COMPLETED) {
            Asset existing = findCompletedAsset(session)
                    .orElseThrow(() -> new StateConflictException(sessionId, UploadStatus.COMPLETED, UploadStatus.COMPLETED));
            log.info("Upload session already completed: uploadSessionId={}, assetId={}", sessionId, existing.getId());
            return new CompletionResult(sessionId, UploadStatus.COMPLETED, existing, true, List.of());
        }

        Optional<Asset> racing = mode == UploadMode.CREATE
                ? assets.findByUploadSessionIdAndDeletedAtIsNull(sessionId)
                : Optional.empty();
        if (racing.isPresent()) {
            Asset adopted = assetMaterializer.adopt(sessionId, racing.get());
            log.info("Asset already exists for session, marked completed: uploadSessionId={}, assetId={}",
                    sessionId, adopted.getId());
            return new CompletionResult(sessionId, UploadStatus.COMPLETED, adopted, true, List.of());
        }

        requireCompletable(session);

        Category category = resolveCategory(context, command.categoryId());
        MetadataValidation metadata = validateMetadata(session, category, command.metadata());

        ObjectStat stat = verifyObject(session);

        String fileName = command.fileName() != null && !command.fileName().isBlank()
                ? command.fileName()
                : session.getOriginalFilename();
        AssetMaterializer.VerifiedUpload upload = new AssetMaterializer.VerifiedUpload(
                stat, fileName, AssetTitles.normalize(command.title(), fileName),
                category, metadata.accepted(), context.userId());

        AssetMaterializer.Materialization materialization;
        try {
            materialization = assetMaterializer.materialize(sessionId, upload);
        } catch (UploadException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to materialise asset for upload session: uploadSessionId={}", sessionId, e);
            failureRecorder.record(sessionId, FailureReason.UNKNOWN, false, e.getMessage());
            throw e;
        }

        Asset asset = materialization.asset();
        if (materialization.created()) {
            if (mode == UploadMode.CREATE) {
                asset = publicationService.apply(asset, category, context.userId());
                eventPublisher.assetCreated(asset);
            } else {
                eventPublisher.assetFileReplaced(asset);
            }
        }
        return new CompletionResult(sessionId, UploadStatus.COMPLETED, asset,
                !materialization.created(), metadata.rejected());
    }

    private void requireCompletable(UploadSession session) {
        Instant now = Instant.now(clock);
        UploadStatus next = session.getStatus() == UploadStatus.INITIATING ? UploadStatus.UPLOADING : UploadStatus.COMPLETED;
        if (!session.canTransitionTo(next, now)) {
            throw new StateConflictException(session.getId(), session.getStatus(), UploadStatus.COMPLETED);
        }
    }

    private Category resolveCategory(UploadContext context, UUID categoryId) {
        if (categoryId == null) {
            return null;
        }
        return categories.findByIdAndTenantId(categoryId, context.tenantId())
                .orElseThrow(() -> new InvalidUploadRequestException("Unknown category: " + categoryId));
    }

    private MetadataValidation validateMetadata(UploadSession session, Category category, Map<String, Object> fields) {
        if (fields.isEmpty()) {
            return NO_METADATA;
        }
        MetadataValidation validation = metadataFieldWriter.validate(
                session.getTenantId(), category != null ? category.getId() : null, fields);
        if (validation.allRejected()) {
            log.warn("All metadata fields rejected for upload session: uploadSessionId={}, fields={}",
                    session.getId(), validation.rejected());
            failureRecorder.record(session.getId(), FailureReason.METADATA_REJECTED, false,
                    "Metadata fields rejected: " + validation.rejected());
            throw new MetadataPersistenceFailedException(session.getId(), validation.rejected());
        }
        if (validation.partiallyRejected()) {
            log.warn("Some metadata fields rejected for upload session: uploadSessionId={}, rejected={}, accepted={}",
                    session.getId(), validation.rejected(), validation.accepted().size());
        }
        return validation;
    }

    /**
     * Assembles a chunked transfer, then reads the object's real size and type from the store.
     */
    private ObjectStat verifyObject(UploadSession session) {
        String bucket = bucketService.findBucketName(session.getStorageBucketId())
                .orElseThrow(() -> new BucketNotReadyException(session.getTenantId(), "bucket record is missing"));
        try {
            if (session.getType() == UploadType.CHUNKED) {
                multipartAssembler.assemble(session, bucket);
            }
            ObjectStat stat = objectStore.stat(bucket, session.objectKey());
            if (!stat.exists()) {
                throw new UploadedObjectMissingException(session.getId(), session.objectKey());
            }
            if (stat.sizeBytes() != session.getExpectedSize()) {
                throw new SizeMismatchException(session.getId(), session.getExpectedSize(), stat.sizeBytes());
            }
            return stat;
        } catch (TransferAssemblyFailedException e) {
            failureRecorder.record(session.getId(), FailureReason.ASSEMBLY_FAILED, e.isTerminal(), e.getMessage());
            throw e;
        } catch (UploadedObjectMissingException e) {
            failureRecorder.record(session.getId(), FailureReason.OBJECT_MISSING, false, e.getMessage());
            throw e;
        } catch (SizeMismatchException e) {
            log.warn("Uploaded object size mismatch: uploadSessionId={}, expected={}, observed={}",
                    session.getId(), e.getExpectedSize(), e.getObservedSize());
            failureRecorder.record(session.getId(), FailureReason.SIZE_MISMATCH, true, e.getMessage());
            throw e;
        } catch (RemoteUnavailableException e) {
            log.warn("Object store unavailable during completion: uploadSessionId={}, error={}",
                    session.getId(), e.getMessage());
            failureRecorder.record(session.getId(), FailureReason.REMOTE_UNAVAILABLE, false, e.getMessage());
            throw e;
        }
    }

    /**
     * Replace sessions never own their asset row; they are tied to it through the target id.
     */
    private Optional<Asset> findCompletedAsset(UploadSession session) {
        if (session.getMode() == UploadMode.REPLACE) {
            return assets.findByIdAndTenantIdAndDeletedAtIsNull(session.getAssetId(), session.getTenantId());
        }
        return assets.findByUploadSessionIdAndDeletedAtIsNull(session.getId());
    }
}
