package com.assetvault.upload.repo;

import com.assetvault.upload.entity.Asset;

/**
 * Outcome of inserting the asset for an upload session: either this call wrote the row,
 * or another completion already had and the existing row is returned.
 */
public sealed interface AssetInsertResult {

    Asset asset();

    record Created(Asset asset) implements AssetInsertResult {
    }

    record AlreadyExists(Asset asset) implements AssetInsertResult {
    }
}
