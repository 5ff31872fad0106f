package com.assetvault.upload.gateway;

import java.util.UUID;

/**
 * Billing-side yes/no on whether a tenant may upload a file of the given size.
 */
public interface PlanLimitGate {

    PlanDecision checkUploadAllowed(UUID tenantId, long sizeBytes);
}
