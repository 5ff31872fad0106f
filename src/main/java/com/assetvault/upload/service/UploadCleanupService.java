package com.assetvault.upload.service;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.dto.CleanupReport;
import com.assetvault.upload.repo.UploadSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Sweeps abandoned sessions: flags overdue live sessions as expired and clears the
 * temporary objects and open transfers of failed, cancelled and expired ones.
 *
 * <p>Nothing schedules this; it is invoked by whoever runs maintenance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadCleanupService {

    private static final Set<UploadStatus> CLEANABLE = EnumSet.of(
            UploadStatus.FAILED, UploadStatus.CANCELLED, UploadStatus.EXPIRED);
    private static final Set<UploadStatus> LIVE = EnumSet.of(UploadStatus.INITIATING, UploadStatus.UPLOADING);

    private final UploadSessionRepository sessions;
    private final UploadSessionStore sessionStore;
    private final TempObjectCleaner tempObjectCleaner;
    private final Clock clock;

    public CleanupReport cleanupExpiredAndTerminal(Duration olderThan) {
        Instant cutoff = Instant.now(clock).minus(olderThan);
        List<UploadSession> candidates = sessions.findCleanupCandidates(CLEANABLE, LIVE, cutoff);

        int completed = 0;
        int failed = 0;
        for (UploadSession candidate : candidates) {
            try {
                UploadSession session = sessionStore.load(candidate.getId());
                if (!session.isTerminal()) {
                    continue;
                }
                boolean cleaned = tempObjectCleaner.cleanup(session);
                sessionStore.markCleanupAttempt(session.getId());
                if (cleaned) {
                    completed++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Upload session cleanup failed: uploadSessionId={}, error={}",
                        candidate.getId(), e.getMessage());
            }
        }

        if (!candidates.isEmpty()) {
            log.info("Upload session cleanup finished: attempted={}, completed={}, failed={}",
                    candidates.size(), completed, failed);
        }
        return new CleanupReport(candidates.size(), completed, failed);
    }
}
