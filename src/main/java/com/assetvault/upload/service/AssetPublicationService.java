package com.assetvault.upload.service;

import com.assetvault.upload.entity.ApprovalStatus;
import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.Category;
import com.assetvault.upload.gateway.ApprovalNotifier;
import com.assetvault.upload.repo.AssetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Category-driven publication of a new asset: held for approval when the category asks
 * for it, published straight away otherwise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetPublicationService {

    private final AssetRepository assets;
    private final ApprovalNotifier approvalNotifier;
    private final Clock clock;

    public Asset apply(Asset asset, Category category, UUID userId) {
        if (category != null && category.isRequiresApproval()) {
            asset.setPublished(false);
            asset.setApprovalStatus(ApprovalStatus.PENDING);
            Asset saved = assets.save(asset);
            log.info("Asset held for approval: assetId={}, categoryId={}", asset.getId(), category.getId());
            try {
                approvalNotifier.assetPendingApproval(saved, userId);
            } catch (RuntimeException e) {
                log.warn("Failed to notify approvers: assetId={}, error={}", asset.getId(), e.getMessage());
            }
            return saved;
        }
        asset.setPublished(true);
        asset.setApprovalStatus(ApprovalStatus.NOT_REQUIRED);
        asset.setPublishedBy(userId);
        asset.setPublishedAt(Instant.now(clock));
        return assets.save(asset);
    }
}
