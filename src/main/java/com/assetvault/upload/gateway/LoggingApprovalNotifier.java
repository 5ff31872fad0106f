package com.assetvault.upload.gateway;

import com.assetvault.upload.entity.Asset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
public class LoggingApprovalNotifier implements ApprovalNotifier {

    @Override
    public void assetPendingApproval(Asset asset, UUID submittedBy) {
        log.info("Asset awaiting approval: assetId={}, categoryId={}, tenantId={}, submittedBy={}",
                asset.getId(), asset.getCategoryId(), asset.getTenantId(), submittedBy);
    }
}
