package com.assetvault.upload.repo;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UploadSessionRepository extends JpaRepository<UploadSession, UUID> {
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from UploadSession s where s.id = :id")
    Optional<UploadSession> lockById(@Param("id") UUID id);

    @Query("""
            select s from UploadSession s
            where ((s.status in :terminal and s.updatedAt < :cutoff)
                or (s.status in :live and s.expiresAt < :cutoff))
              and (s.lastCleanupAttemptAt is null or s.lastCleanupAttemptAt < :cutoff)
            order by s.updatedAt
            """)
    List<UploadSession> findCleanupCandidates(@Param("terminal") Collection<UploadStatus> terminal,
                                              @Param("live") Collection<UploadStatus> live,
                                              @Param("cutoff") Instant cutoff);
}
