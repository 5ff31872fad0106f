package com.assetvault.upload.service;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.dto.TransitionOutcome;
import com.assetvault.upload.entity.dto.UploadContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Tenant-scoped session operations that do not produce an asset: reading, the upload
 * start signal, the activity heartbeat and cancellation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadLifecycleService {

    private final UploadSessionStore sessionStore;
    private final TempObjectCleaner tempObjectCleaner;

    public UploadSession get(UploadContext context, UUID sessionId) {
        return sessionStore.load(sessionId, context.tenantId());
    }

    public TransitionOutcome markUploading(UploadContext context, UUID sessionId) {
        sessionStore.load(sessionId, context.tenantId());
        return sessionStore.markUploading(sessionId);
    }

    public UploadSession touch(UploadContext context, UUID sessionId) {
        sessionStore.load(sessionId, context.tenantId());
        return sessionStore.touch(sessionId);
    }

    /**
     * Cancels a live session and removes whatever it left in the object store. Cancelling
     * a finished session does nothing and says so. Remote cleanup never fails the call.
     */
    public TransitionOutcome cancel(UploadContext context, UUID sessionId) {
        sessionStore.load(sessionId, context.tenantId());
        TransitionOutcome outcome = sessionStore.cancel(sessionId);
        if (!outcome.transitioned()) {
            return outcome;
        }
        UploadSession session = sessionStore.load(sessionId);
        if (!tempObjectCleaner.cleanup(session)) {
            log.warn("Upload session cancelled but remote cleanup incomplete: uploadSessionId={}", sessionId);
        }
        return outcome;
    }
}
