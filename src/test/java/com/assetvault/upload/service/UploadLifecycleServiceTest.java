package com.assetvault.upload.service;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.dto.TransitionOutcome;
import com.assetvault.upload.entity.dto.UploadContext;
import com.assetvault.upload.exception.UploadSessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static com.assetvault.upload.util.UploadSessionTestBuilder.TENANT_ID;
import static com.assetvault.upload.util.UploadSessionTestBuilder.aSession;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UploadLifecycleService")
class UploadLifecycleServiceTest {

    @Mock
    private UploadSessionStore sessionStore;

    @Mock
    private TempObjectCleaner tempObjectCleaner;

    private UploadLifecycleService service;
    private final UploadContext context = new UploadContext(TENANT_ID, null, null);

    @BeforeEach
    void setUp() {
        service = new UploadLifecycleService(sessionStore, tempObjectCleaner);
    }

    @Test
    @DisplayName("should clean remote leftovers after cancelling")
    void shouldCleanupAfterCancel() {
        UploadSession session = aSession().chunked("mp-1").status(UploadStatus.CANCELLED).build();
        when(sessionStore.load(session.getId(), TENANT_ID)).thenReturn(session);
        when(sessionStore.cancel(session.getId()))
                .thenReturn(new TransitionOutcome(session.getId(), UploadStatus.CANCELLED, true));
        when(sessionStore.load(session.getId())).thenReturn(session);
        when(tempObjectCleaner.cleanup(session)).thenReturn(false);

        TransitionOutcome outcome = service.cancel(context, session.getId());

        assertThat(outcome.transitioned()).isTrue();
        verify(tempObjectCleaner).cleanup(session);
    }

    @Test
    @DisplayName("should do nothing remotely when cancelling a finished session")
    void shouldSkipCleanupWhenNoop() {
        UploadSession session = aSession().status(UploadStatus.COMPLETED).build();
        when(sessionStore.load(session.getId(), TENANT_ID)).thenReturn(session);
        when(sessionStore.cancel(session.getId()))
                .thenReturn(new TransitionOutcome(session.getId(), UploadStatus.COMPLETED, false));

        TransitionOutcome outcome = service.cancel(context, session.getId());

        assertThat(outcome.transitioned()).isFalse();
        verifyNoInteractions(tempObjectCleaner);
    }

    @Test
    @DisplayName("should check tenant ownership before any transition")
    void shouldCheckOwnership() {
        UUID sessionId = UUID.randomUUID();
        when(sessionStore.load(sessionId, TENANT_ID)).thenThrow(new UploadSessionNotFoundException(sessionId));

        assertThatThrownBy(() -> service.markUploading(context, sessionId))
                .isInstanceOf(UploadSessionNotFoundException.class);
        verify(sessionStore, never()).markUploading(any());
    }
}
