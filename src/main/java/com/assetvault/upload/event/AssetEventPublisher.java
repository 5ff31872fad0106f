package com.assetvault.upload.event;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.AssetType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands a freshly materialised asset to the downstream workers (thumbnails, previews,
 * metadata extraction) through Redis list queues. This service does none of that work.
 *
 * <p>Queue pushes are best-effort: a failure is logged and never fails the upload.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetEventPublisher {

    static final String ASSET_CREATED_QUEUE = "asset-created-queue";
    static final String ASSET_REPLACED_QUEUE = "asset-replaced-queue";
    static final String THUMBNAIL_QUEUE = "thumbnail-queue";
    static final String VIDEO_PREVIEW_QUEUE = "video-preview-queue";
    static final String METADATA_QUEUE = "metadata-queue";

    private final StringRedisTemplate redisTemplate;

    public void assetCreated(Asset asset) {
        push(ASSET_CREATED_QUEUE, asset);
        processingMayBegin(asset);
    }

    public void assetFileReplaced(Asset asset) {
        push(ASSET_REPLACED_QUEUE, asset);
        processingMayBegin(asset);
    }

    private void processingMayBegin(Asset asset) {
        AssetType type = asset.getType() != null ? asset.getType() : AssetType.OTHER;
        if (type.needs(AssetType.Derivative.THUMBNAIL)) {
            push(THUMBNAIL_QUEUE, asset);
        }
        if (type.needs(AssetType.Derivative.VIDEO_PREVIEW)) {
            push(VIDEO_PREVIEW_QUEUE, asset);
        }
        push(METADATA_QUEUE, asset);
    }

    private void push(String queue, Asset asset) {
        try {
            redisTemplate.opsForList().rightPush(queue, asset.getId().toString());
            log.debug("Queued asset={} on {}", asset.getId(), queue);
        } catch (RuntimeException e) {
            log.warn("Failed to queue asset={} on {}: {}", asset.getId(), queue, e.getMessage());
        }
    }
}
