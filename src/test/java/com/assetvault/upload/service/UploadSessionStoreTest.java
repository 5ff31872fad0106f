package com.assetvault.upload.service;

import com.assetvault.upload.entity.FailureReason;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.dto.TransitionOutcome;
import com.assetvault.upload.entity.dto.UploadGrant;
import com.assetvault.upload.exception.StateConflictException;
import com.assetvault.upload.exception.UploadSessionNotFoundException;
import com.assetvault.upload.repo.UploadSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static com.assetvault.upload.util.UploadSessionTestBuilder.NOW;
import static com.assetvault.upload.util.UploadSessionTestBuilder.aSession;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
@DisplayName("UploadSessionStore")
class UploadSessionStoreTest {

    @Mock
    private UploadSessionRepository sessions;

    private UploadSessionStore store;

    @BeforeEach
    void setUp() {
        store = new UploadSessionStore(sessions, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(sessions.save(any(UploadSession.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private UploadSession stored(UploadSession session) {
        lenient().when(sessions.lockById(session.getId())).thenReturn(Optional.of(session));
        lenient().when(sessions.findById(session.getId())).thenReturn(Optional.of(session));
        return session;
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("should expire an overdue session on read")
        void shouldExpireLazily() {
            UploadSession session = stored(aSession().expiresAt(NOW.minusSeconds(5)).build());

            UploadSession loaded = store.load(session.getId());

            assertThat(loaded.getStatus()).isEqualTo(UploadStatus.EXPIRED);
            assertThat(loaded.getFailureReason()).isEqualTo(FailureReason.EXPIRED);
        }

        @Test
        @DisplayName("should hide sessions of other tenants")
        void shouldHideOtherTenants() {
            UploadSession session = stored(aSession().build());

            assertThatThrownBy(() -> store.load(session.getId(), UUID.randomUUID()))
                    .isInstanceOf(UploadSessionNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("markUploading")
    class MarkUploading {

        @Test
        @DisplayName("should move INITIATING to UPLOADING")
        void shouldTransition() {
            UploadSession session = stored(aSession().build());

            TransitionOutcome outcome = store.markUploading(session.getId());

            assertThat(outcome.transitioned()).isTrue();
            assertThat(outcome.status()).isEqualTo(UploadStatus.UPLOADING);
            assertThat(session.getLastActivityAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should only refresh activity when already uploading")
        void shouldBeIdempotent() {
            UploadSession session = stored(aSession().status(UploadStatus.UPLOADING).build());

            TransitionOutcome outcome = store.markUploading(session.getId());

            assertThat(outcome.transitioned()).isFalse();
            assertThat(outcome.status()).isEqualTo(UploadStatus.UPLOADING);
            assertThat(session.getLastActivityAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should reject an expired session")
        void shouldRejectExpired() {
            UploadSession session = stored(aSession().expiresAt(NOW.minusSeconds(1)).build());

            assertThatThrownBy(() -> store.markUploading(session.getId()))
                    .isInstanceOfSatisfying(StateConflictException.class,
                            e -> assertThat(e.getCurrentStatus()).isEqualTo(UploadStatus.EXPIRED));
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("should cancel once and report a no-op the second time")
        void shouldBeIdempotent() {
            UploadSession session = stored(aSession().status(UploadStatus.UPLOADING).build());

            TransitionOutcome first = store.cancel(session.getId());
            TransitionOutcome second = store.cancel(session.getId());

            assertThat(first.transitioned()).isTrue();
            assertThat(first.status()).isEqualTo(UploadStatus.CANCELLED);
            assertThat(second.transitioned()).isFalse();
            assertThat(second.status()).isEqualTo(UploadStatus.CANCELLED);
            assertThat(session.getFailureReason()).isEqualTo(FailureReason.CANCELLED_BY_USER);
        }

        @Test
        @DisplayName("should not overwrite a completed session")
        void shouldLeaveCompletedAlone() {
            UploadSession session = stored(aSession().status(UploadStatus.COMPLETED).build());

            TransitionOutcome outcome = store.cancel(session.getId());

            assertThat(outcome.transitioned()).isFalse();
            assertThat(session.getStatus()).isEqualTo(UploadStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("recordFailure")
    class RecordFailure {

        @Test
        @DisplayName("should count a retryable failure without leaving the live state")
        void shouldCountNonTerminal() {
            UploadSession session = stored(aSession().status(UploadStatus.UPLOADING).build());

            UploadSession updated = store.recordFailure(session.getId(), FailureReason.REMOTE_UNAVAILABLE, false);

            assertThat(updated.getFailureCount()).isEqualTo(1);
            assertThat(updated.getStatus()).isEqualTo(UploadStatus.UPLOADING);
        }

        @Test
        @DisplayName("should fail the session on a hard failure")
        void shouldFailOnTerminal() {
            UploadSession session = stored(aSession().status(UploadStatus.UPLOADING).build());

            UploadSession updated = store.recordFailure(session.getId(), FailureReason.SIZE_MISMATCH, true);

            assertThat(updated.getStatus()).isEqualTo(UploadStatus.FAILED);
            assertThat(updated.getFailureReason()).isEqualTo(FailureReason.SIZE_MISMATCH);
        }

        @Test
        @DisplayName("should not touch a session that is already terminal")
        void shouldIgnoreTerminal() {
            UploadSession session = stored(aSession().status(UploadStatus.CANCELLED).build());

            UploadSession updated = store.recordFailure(session.getId(), FailureReason.UNKNOWN, true);

            assertThat(updated.getStatus()).isEqualTo(UploadStatus.CANCELLED);
            assertThat(updated.getFailureCount()).isZero();
        }
    }

    @Test
    @DisplayName("should keep the first multipart transfer id attached")
    void shouldKeepFirstTransferId() {
        UploadSession session = stored(aSession().chunked("first").build());

        UploadSession updated = store.attachMultipartUploadId(session.getId(), "second");

        assertThat(updated.getMultipartUploadId()).isEqualTo("first");
    }

    @Test
    @DisplayName("should attach a support ticket only once")
    void shouldAttachTicketOnce() {
        UploadSession session = stored(aSession().status(UploadStatus.FAILED).build());

        assertThat(store.attachTicket(session.getId(), "UPL-1")).isTrue();
        assertThat(store.attachTicket(session.getId(), "UPL-2")).isFalse();
        assertThat(session.getTicketReference()).isEqualTo("UPL-1");
    }

    @Test
    @DisplayName("should persist the draft and its transfer id when opening")
    void shouldOpenWithGrant() {
        UploadSession draft = aSession().chunked(null).build();

        UploadGrant grant = store.open(draft, s -> UploadGrant.chunked("mp-1", 10L));

        assertThat(grant.multipartUploadId()).isEqualTo("mp-1");
        assertThat(draft.getMultipartUploadId()).isEqualTo("mp-1");
    }
}
