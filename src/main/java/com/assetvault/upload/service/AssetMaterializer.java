package com.assetvault.upload.service;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.AssetClassification;
import com.assetvault.upload.entity.AssetType;
import com.assetvault.upload.entity.Category;
import com.assetvault.upload.entity.UploadMode;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.exception.AssetNotFoundException;
import com.assetvault.upload.gateway.MetadataFieldWriter;
import com.assetvault.upload.repo.AssetInsertResult;
import com.assetvault.upload.repo.AssetNativeRepository;
import com.assetvault.upload.repo.AssetRepository;
import com.assetvault.upload.repo.UploadSessionRepository;
import com.assetvault.upload.storage.ObjectStat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The atomic step of completion: under the session's row lock, writes (or finds) the
 * asset for the session and marks the session COMPLETED with the verified size.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetMaterializer {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final UploadSessionStore sessionStore;
    private final UploadSessionRepository sessions;
    private final AssetRepository assets;
    private final AssetNativeRepository assetNativeRepository;
    private final MetadataFieldWriter metadataFieldWriter;
    private final Clock clock;

    /**
     * Facts about the uploaded file. Everything except the labels comes from the object store.
     */
    public record VerifiedUpload(
            ObjectStat stat,
            String originalFilename,
            String title,
            Category category,
            Map<String, Object> acceptedMetadata,
            UUID userId
    ) {
    }

    /**
     * @param created true when this call wrote the asset (or, in replace mode, swapped its file)
     */
    public record Materialization(Asset asset, boolean created) {
    }

    @Transactional
    public Materialization materialize(UUID sessionId, VerifiedUpload upload) {
        UploadSession session = sessionStore.lock(sessionId);
        if (session.getMode() == UploadMode.REPLACE && session.getStatus() == UploadStatus.COMPLETED) {
            Asset target = assets.lockById(session.getAssetId())
                    .orElseThrow(() -> new AssetNotFoundException(session.getAssetId()));
            log.info("Replace already applied for session, reusing target asset: uploadSessionId={}, assetId={}",
                    sessionId, target.getId());
            return new Materialization(target, false);
        }
        Optional<Asset> racing = session.getMode() == UploadMode.CREATE
                ? assets.lockByUploadSessionId(sessionId)
                : Optional.empty();
        if (racing.isPresent()) {
            markCompleted(session, racing.get().getSizeBytes());
            log.info("Asset already materialised for session, reusing it: uploadSessionId={}, assetId={}",
                    sessionId, racing.get().getId());
            return new Materialization(racing.get(), false);
        }

        Instant now = Instant.now(clock);
        if (session.getStatus() == UploadStatus.INITIATING) {
            session.transitionTo(UploadStatus.UPLOADING, now);
        }
        session.transitionTo(UploadStatus.COMPLETED, now);
        session.setUploadedSize(upload.stat().sizeBytes());

        Materialization result = session.getMode() == UploadMode.REPLACE
                ? replaceFile(session, upload)
                : createAsset(session, upload, now);
        sessions.save(session);

        log.info("[Upload Lifecycle] Upload session completed: uploadSessionId={}, assetId={}, size={}, created={}",
                sessionId, result.asset().getId(), upload.stat().sizeBytes(), result.created());
        return result;
    }

    /**
     * Completes a session whose asset was committed by an earlier call.
     */
    @Transactional
    public Asset adopt(UUID sessionId, Asset asset) {
        UploadSession session = sessionStore.lock(sessionId);
        markCompleted(session, asset.getSizeBytes());
        return asset;
    }

    private Materialization createAsset(UploadSession session, VerifiedUpload upload, Instant now) {
        Category category = upload.category();
        Asset asset = new Asset();
        asset.setId(UUID.randomUUID());
        asset.setTenantId(session.getTenantId());
        asset.setBrandId(session.getBrandId());
        asset.setUploadSessionId(session.getId());
        asset.setStorageBucketId(session.getStorageBucketId());
        asset.setStoragePath(session.objectKey());
        asset.setOriginalFilename(upload.originalFilename());
        asset.setTitle(upload.title());
        asset.setMimeType(contentType(upload.stat()));
        asset.setSizeBytes(upload.stat().sizeBytes());
        asset.setType(AssetType.fromMimeType(asset.getMimeType()));
        asset.setCategoryId(category != null ? category.getId() : null);
        asset.setClassification(category != null ? category.getAssetClassification() : AssetClassification.ASSET);
        asset.setCreatedBy(upload.userId());
        asset.setCreatedAt(now);
        asset.setUpdatedAt(now);

        AssetInsertResult inserted = assetNativeRepository.insertIfAbsent(asset);
        if (inserted instanceof AssetInsertResult.AlreadyExists existing) {
            log.info("Concurrent completion won the insert, reusing its asset: uploadSessionId={}, assetId={}",
                    session.getId(), existing.asset().getId());
            session.setUploadedSize(existing.asset().getSizeBytes());
            return new Materialization(existing.asset(), false);
        }
        metadataFieldWriter.persist(asset.getId(), upload.acceptedMetadata(), upload.userId());
        return new Materialization(inserted.asset(), true);
    }

    private Materialization replaceFile(UploadSession session, VerifiedUpload upload) {
        Asset asset = assets.lockById(session.getAssetId())
                .orElseThrow(() -> new AssetNotFoundException(session.getAssetId()));
        asset.setStorageBucketId(session.getStorageBucketId());
        asset.setStoragePath(session.objectKey());
        asset.setSizeBytes(upload.stat().sizeBytes());
        asset.setMimeType(contentType(upload.stat()));
        asset.setType(AssetType.fromMimeType(asset.getMimeType()));
        return new Materialization(assets.save(asset), true);
    }

    private void markCompleted(UploadSession session, long sizeBytes) {
        if (session.getStatus() == UploadStatus.COMPLETED) {
            return;
        }
        Instant now = Instant.now(clock);
        if (session.getStatus() == UploadStatus.INITIATING) {
            session.transitionTo(UploadStatus.UPLOADING, now);
        }
        session.transitionTo(UploadStatus.COMPLETED, now);
        session.setUploadedSize(sizeBytes);
        sessions.save(session);
    }

    private static String contentType(ObjectStat stat) {
        return stat.contentType() == null || stat.contentType().isBlank() ? DEFAULT_CONTENT_TYPE : stat.contentType();
    }
}
