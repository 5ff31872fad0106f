package com.assetvault.upload.gateway;

import com.assetvault.upload.config.UploadProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Flat per-file ceiling from configuration, used until the billing service supplies plans.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredPlanLimitGate implements PlanLimitGate {

    private final UploadProperties properties;

    @Override
    public PlanDecision checkUploadAllowed(UUID tenantId, long sizeBytes) {
        long limit = properties.defaultMaxUploadBytes();
        return sizeBytes > limit ? PlanDecision.limitExceeded(limit) : PlanDecision.allowed();
    }
}
