package com.assetvault.upload.gateway;

import java.util.Map;
import java.util.UUID;

public interface MetadataFieldWriter {

    /**
     * Checks each supplied field against the category's schema. Does not write anything.
     */
    MetadataValidation validate(UUID tenantId, UUID categoryId, Map<String, Object> fields);

    void persist(UUID assetId, Map<String, Object> acceptedFields, UUID userId);
}
