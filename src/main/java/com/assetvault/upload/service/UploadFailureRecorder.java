package com.assetvault.upload.service;

import com.assetvault.upload.config.UploadProperties;
import com.assetvault.upload.entity.FailureReason;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.gateway.SupportTicketGateway;
import com.assetvault.upload.gateway.UploadFailureSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Counts failed completion attempts and opens one support ticket when a session keeps
 * failing. Bookkeeping only: it never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadFailureRecorder {

    private final UploadSessionStore sessionStore;
    private final SupportTicketGateway supportTicketGateway;
    private final UploadProperties properties;

    public void record(UUID sessionId, FailureReason reason, boolean terminal, String message) {
        UploadSession session;
        try {
            session = sessionStore.recordFailure(sessionId, reason, terminal);
        } catch (RuntimeException e) {
            log.warn("Failed to record upload failure: uploadSessionId={}, reason={}, error={}",
                    sessionId, reason, e.getMessage());
            return;
        }
        log.info("Upload failure recorded: uploadSessionId={}, reason={}, terminal={}, failureCount={}",
                sessionId, reason, terminal, session.getFailureCount());

        if (session.getTicketReference() != null || session.getFailureCount() < properties.escalationThreshold()) {
            return;
        }
        try {
            String ticket = supportTicketGateway.openTicket(new UploadFailureSummary(
                    sessionId, session.getTenantId(), session.getFailureCount(), reason, message));
            if (sessionStore.attachTicket(sessionId, ticket)) {
                log.warn("Upload failures escalated: uploadSessionId={}, ticket={}", sessionId, ticket);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to escalate upload failure: uploadSessionId={}, error={}", sessionId, e.getMessage());
        }
    }
}
