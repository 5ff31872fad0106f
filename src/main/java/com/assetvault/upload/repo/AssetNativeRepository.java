package com.assetvault.upload.repo;

import com.assetvault.upload.entity.Asset;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
@RequiredArgsConstructor
public class AssetNativeRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final AssetRepository assetRepository;

    /**
     * Inserts the asset unless a live asset already references the same upload session.
     * The partial unique index on {@code upload_session_id} decides; a losing insert
     * becomes {@link AssetInsertResult.AlreadyExists} carrying the winning row.
     */
    public AssetInsertResult insertIfAbsent(Asset asset) {
        String sql = """
            INSERT INTO assets (
                id, tenant_id, brand_id, upload_session_id, storage_bucket_id, storage_path,
                original_filename, title, mime_type, size_bytes, type,
                category_id, classification, published, approval_status,
                created_by, created_at, updated_at
            )
            VALUES (
                :id, :tenantId, :brandId, :uploadSessionId, :storageBucketId, :storagePath,
                :originalFilename, :title, :mimeType, :sizeBytes, :type,
                :categoryId, :classification, :published, :approvalStatus,
                :createdBy, :createdAt, :updatedAt
            )
            ON CONFLICT (upload_session_id) WHERE deleted_at IS NULL DO NOTHING
            """;

        int inserted = jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", asset.getId())
                .addValue("tenantId", asset.getTenantId())
                .addValue("brandId", asset.getBrandId())
                .addValue("uploadSessionId", asset.getUploadSessionId())
                .addValue("storageBucketId", asset.getStorageBucketId())
                .addValue("storagePath", asset.getStoragePath())
                .addValue("originalFilename", asset.getOriginalFilename())
                .addValue("title", asset.getTitle())
                .addValue("mimeType", asset.getMimeType())
                .addValue("sizeBytes", asset.getSizeBytes())
                .addValue("type", asset.getType() != null ? asset.getType().name() : null)
                .addValue("categoryId", asset.getCategoryId())
                .addValue("classification", asset.getClassification() != null ? asset.getClassification().name() : null)
                .addValue("published", asset.isPublished())
                .addValue("approvalStatus", asset.getApprovalStatus() != null ? asset.getApprovalStatus().name() : null)
                .addValue("createdBy", asset.getCreatedBy())
                .addValue("createdAt", timestamp(asset.getCreatedAt()))
                .addValue("updatedAt", timestamp(asset.getUpdatedAt())));

        if (inserted == 1) {
            return new AssetInsertResult.Created(asset);
        }
        Asset winner = assetRepository.findByUploadSessionIdAndDeletedAtIsNull(asset.getUploadSessionId())
                .orElseThrow(() -> new IllegalStateException(
                        "Asset insert for session " + asset.getUploadSessionId()
                                + " conflicted but no live asset was found"));
        return new AssetInsertResult.AlreadyExists(winner);
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
