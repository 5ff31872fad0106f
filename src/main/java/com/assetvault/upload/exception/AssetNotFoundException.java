package com.assetvault.upload.exception;

import java.util.UUID;

public class AssetNotFoundException extends UploadException {

    public AssetNotFoundException(UUID assetId) {
        super(ErrorCode.NOT_FOUND, false, "Asset not found: " + assetId);
    }
}
