package com.assetvault.upload.gateway;

import java.util.List;
import java.util.Map;

/**
 * Split of client-supplied metadata into fields the category schema accepts and
 * the keys it rejects.
 */
public record MetadataValidation(Map<String, Object> accepted, List<String> rejected) {

    public MetadataValidation {
        accepted = Map.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public boolean allRejected() {
        return accepted.isEmpty() && !rejected.isEmpty();
    }

    public boolean partiallyRejected() {
        return !accepted.isEmpty() && !rejected.isEmpty();
    }
}
