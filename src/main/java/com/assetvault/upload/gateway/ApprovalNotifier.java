package com.assetvault.upload.gateway;

import com.assetvault.upload.entity.Asset;

import java.util.UUID;

public interface ApprovalNotifier {

    void assetPendingApproval(Asset asset, UUID submittedBy);
}
