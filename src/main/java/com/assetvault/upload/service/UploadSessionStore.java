package com.assetvault.upload.service;

import com.assetvault.upload.entity.FailureReason;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.dto.TransitionOutcome;
import com.assetvault.upload.entity.dto.UploadGrant;
import com.assetvault.upload.exception.StateConflictException;
import com.assetvault.upload.exception.UploadSessionNotFoundException;
import com.assetvault.upload.repo.UploadSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Function;

/**
 * Durable record of upload sessions. Every write goes through the state guard on
 * {@link UploadSession}; expiry is detected here, lazily, whenever a session is read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadSessionStore {

    private final UploadSessionRepository sessions;
    private final Clock clock;

    /**
     * Persists a new session and issues its grant inside one fresh transaction. If the
     * grant cannot be issued the session row is rolled back with it, and no sibling
     * transaction is affected.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UploadGrant open(UploadSession draft, Function<UploadSession, UploadGrant> grantIssuer) {
        UploadSession session = sessions.save(draft);
        UploadGrant grant = grantIssuer.apply(session);
        if (grant.multipartUploadId() != null) {
            session.setMultipartUploadId(grant.multipartUploadId());
            session.setLastActivityAt(Instant.now(clock));
            sessions.save(session);
        }
        return grant;
    }

    @Transactional
    public UploadSession load(UUID id) {
        UploadSession session = sessions.findById(id)
                .orElseThrow(() -> new UploadSessionNotFoundException(id));
        if (session.expireIfDue(Instant.now(clock))) {
            log.info("[Upload Lifecycle] Upload session expired on access: uploadSessionId={}, expiresAt={}",
                    id, session.getExpiresAt());
            sessions.save(session);
        }
        return session;
    }

    /**
     * Loads a session on behalf of a tenant. Sessions of other tenants are reported as
     * missing.
     */
    @Transactional
    public UploadSession load(UUID id, UUID tenantId) {
        UploadSession session = load(id);
        if (!session.getTenantId().equals(tenantId)) {
            throw new UploadSessionNotFoundException(id);
        }
        return session;
    }

    /**
     * Row-locked read for callers already inside a transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UploadSession lock(UUID id) {
        UploadSession session = sessions.lockById(id)
                .orElseThrow(() -> new UploadSessionNotFoundException(id));
        if (session.expireIfDue(Instant.now(clock))) {
            log.info("[Upload Lifecycle] Upload session expired on access: uploadSessionId={}", id);
        }
        return session;
    }

    @Transactional(noRollbackFor = StateConflictException.class)
    public TransitionOutcome markUploading(UUID id) {
        UploadSession session = lock(id);
        Instant now = Instant.now(clock);
        if (session.getStatus() == UploadStatus.UPLOADING) {
            session.setLastActivityAt(now);
            sessions.save(session);
            return new TransitionOutcome(id, session.getStatus(), false);
        }
        session.transitionTo(UploadStatus.UPLOADING, now);
        sessions.save(session);
        log.info("[Upload Lifecycle] Upload session marked as UPLOADING: uploadSessionId={}, tenantId={}",
                id, session.getTenantId());
        return new TransitionOutcome(id, session.getStatus(), true);
    }

    @Transactional
    public UploadSession touch(UUID id) {
        UploadSession session = lock(id);
        if (!session.isTerminal()) {
            session.setLastActivityAt(Instant.now(clock));
        }
        return sessions.save(session);
    }

    /**
     * Moves a live session to CANCELLED. A terminal session is left untouched and the
     * outcome reports that nothing happened.
     */
    @Transactional
    public TransitionOutcome cancel(UUID id) {
        UploadSession session = lock(id);
        if (session.isTerminal()) {
            sessions.save(session);
            log.info("Upload session cancellation called but already in terminal state: uploadSessionId={}, status={}",
                    id, session.getStatus());
            return new TransitionOutcome(id, session.getStatus(), false);
        }
        session.transitionTo(UploadStatus.CANCELLED, Instant.now(clock));
        session.setFailureReason(FailureReason.CANCELLED_BY_USER);
        sessions.save(session);
        log.info("Upload session cancelled: uploadSessionId={}, clientReference={}, tenantId={}",
                id, session.getClientReference(), session.getTenantId());
        return new TransitionOutcome(id, session.getStatus(), true);
    }

    /**
     * Records the multipart transfer id unless another call already attached one; the
     * returned session carries whichever id won.
     */
    @Transactional(noRollbackFor = StateConflictException.class)
    public UploadSession attachMultipartUploadId(UUID id, String multipartUploadId) {
        UploadSession session = lock(id);
        if (session.isTerminal()) {
            throw new StateConflictException(id, session.getStatus(), UploadStatus.UPLOADING);
        }
        if (session.getMultipartUploadId() == null) {
            session.setMultipartUploadId(multipartUploadId);
        }
        session.setLastActivityAt(Instant.now(clock));
        return sessions.save(session);
    }

    /**
     * Counts a failed completion attempt in its own transaction so it survives the
     * rollback of the attempt. With {@code terminal} the session also moves to FAILED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UploadSession recordFailure(UUID id, FailureReason reason, boolean terminal) {
        UploadSession session = sessions.lockById(id)
                .orElseThrow(() -> new UploadSessionNotFoundException(id));
        Instant now = Instant.now(clock);
        if (session.expireIfDue(now) || session.isTerminal()) {
            return sessions.save(session);
        }
        session.setFailureCount(session.getFailureCount() + 1);
        session.setFailureReason(reason);
        if (terminal) {
            session.transitionTo(UploadStatus.FAILED, now);
        }
        return sessions.save(session);
    }

    /**
     * Attaches the escalation ticket. Allowed once, terminal or not.
     */
    @Transactional
    public boolean attachTicket(UUID id, String ticketReference) {
        UploadSession session = sessions.lockById(id)
                .orElseThrow(() -> new UploadSessionNotFoundException(id));
        if (session.getTicketReference() != null) {
            return false;
        }
        session.setTicketReference(ticketReference);
        sessions.save(session);
        return true;
    }

    @Transactional
    public void markCleanupAttempt(UUID id) {
        sessions.findById(id).ifPresent(session -> {
            session.setLastCleanupAttemptAt(Instant.now(clock));
            sessions.save(session);
        });
    }
}
