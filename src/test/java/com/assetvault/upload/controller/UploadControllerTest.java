package com.assetvault.upload.controller;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.UploadStatus;
import com.assetvault.upload.entity.UploadType;
import com.assetvault.upload.entity.dto.BatchItemResult;
import com.assetvault.upload.entity.dto.CompleteUploadCommand;
import com.assetvault.upload.entity.dto.CompletionResult;
import com.assetvault.upload.entity.dto.InitiationResult;
import com.assetvault.upload.entity.dto.TransitionOutcome;
import com.assetvault.upload.entity.dto.UploadContext;
import com.assetvault.upload.exception.ErrorCode;
import com.assetvault.upload.exception.InvalidUploadRequestException;
import com.assetvault.upload.exception.PlanLimitExceededException;
import com.assetvault.upload.exception.SizeMismatchException;
import com.assetvault.upload.exception.StateConflictException;
import com.assetvault.upload.exception.UploadSessionNotFoundException;
import com.assetvault.upload.service.MultipartUploadService;
import com.assetvault.upload.service.UploadCompletionService;
import com.assetvault.upload.service.UploadInitiationService;
import com.assetvault.upload.service.UploadLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.assetvault.upload.controller.UploadController.TENANT_HEADER;
import static com.assetvault.upload.controller.UploadController.USER_HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("UploadController")
class UploadControllerTest {

    private static final UUID TENANT_ID = UUID.randomUUID();

    @Mock
    private UploadInitiationService initiationService;

    @Mock
    private MultipartUploadService multipartService;

    @Mock
    private UploadCompletionService completionService;

    @Mock
    private UploadLifecycleService lifecycleService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        UploadController controller = new UploadController(initiationService, multipartService,
                completionService, lifecycleService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new UploadExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("initiate")
    class Initiate {

        @Test
        @DisplayName("should return 201 with the presigned URL")
        void shouldInitiate() throws Exception {
            UUID sessionId = UUID.randomUUID();
            when(initiationService.initiate(any(), any())).thenReturn(new InitiationResult(sessionId, "c-1", null,
                    UploadStatus.INITIATING, UploadType.DIRECT, "https://s3/put", null, null,
                    Instant.parse("2024-05-01T11:00:00Z")));

            mockMvc.perform(post("/api/v1/uploads")
                            .header(TENANT_HEADER, TENANT_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"fileName":"photo.jpg","fileSize":1024,"mimeType":"image/jpeg","clientReference":"c-1"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.uploadSessionId").value(sessionId.toString()))
                    .andExpect(jsonPath("$.uploadUrl").value("https://s3/put"));

            ArgumentCaptor<UploadContext> context = ArgumentCaptor.forClass(UploadContext.class);
            verify(initiationService).initiate(context.capture(), any());
            assertThat(context.getValue().tenantId()).isEqualTo(TENANT_ID);
        }

        @Test
        @DisplayName("should reject a non-positive size before reaching the service")
        void shouldValidateBody() throws Exception {
            mockMvc.perform(post("/api/v1/uploads")
                            .header(TENANT_HEADER, TENANT_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"fileName":"photo.jpg","fileSize":0}
                                    """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

            verifyNoInteractions(initiationService);
        }

        @Test
        @DisplayName("should require the tenant header")
        void shouldRequireTenant() throws Exception {
            mockMvc.perform(post("/api/v1/uploads")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"fileName":"photo.jpg","fileSize":10}
                                    """))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(initiationService);
        }

        @Test
        @DisplayName("should map a plan limit to 403 with the limits")
        void shouldMapPlanLimit() throws Exception {
            when(initiationService.initiate(any(), any()))
                    .thenThrow(new PlanLimitExceededException(TENANT_ID, 2048, 1024));

            mockMvc.perform(post("/api/v1/uploads")
                            .header(TENANT_HEADER, TENANT_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"fileName":"photo.jpg","fileSize":2048}
                                    """))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("PLAN_LIMIT_EXCEEDED"))
                    .andExpect(jsonPath("$.limitBytes").value(1024))
                    .andExpect(jsonPath("$.retryable").value(false));
        }

        @Test
        @DisplayName("should return per-file outcomes for a batch")
        void shouldInitiateBatch() throws Exception {
            when(initiationService.initiateBatch(any(), anyList())).thenReturn(List.of(
                    BatchItemResult.failure("a", "batch-1", ErrorCode.PLAN_LIMIT_EXCEEDED, "too big", false)));

            mockMvc.perform(post("/api/v1/uploads/batch")
                            .header(TENANT_HEADER, TENANT_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"files":[{"fileName":"a.jpg","fileSize":10,"clientReference":"a"}]}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.uploads[0].clientReference").value("a"))
                    .andExpect(jsonPath("$.uploads[0].errorCode").value("PLAN_LIMIT_EXCEEDED"));
        }
    }

    @Test
    @DisplayName("should leave the batch size cap to the configured service limit")
    void shouldDelegateBatchCap() throws Exception {
        String files = IntStream.rangeClosed(1, 150)
                .mapToObj(i -> "{\"fileName\":\"f" + i + ".jpg\",\"fileSize\":10}")
                .collect(Collectors.joining(",", "{\"files\":[", "]}"));
        when(initiationService.initiateBatch(any(), anyList()))
                .thenThrow(new InvalidUploadRequestException("Batch of 150 files exceeds the limit of 100"));

        mockMvc.perform(post("/api/v1/uploads/batch")
                        .header(TENANT_HEADER, TENANT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(files))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        verify(initiationService).initiateBatch(any(), argThat(commands -> commands.size() == 150));
    }

    @Nested
    @DisplayName("complete")
    class Complete {

        @Test
        @DisplayName("should complete without a body")
        void shouldCompleteWithoutBody() throws Exception {
            UUID sessionId = UUID.randomUUID();
            UUID userId = UUID.randomUUID();
            Asset asset = new Asset();
            asset.setId(UUID.randomUUID());
            asset.setTitle("Photo");
            asset.setSizeBytes(1024);
            when(completionService.complete(any(), eq(sessionId), any()))
                    .thenReturn(new CompletionResult(sessionId, UploadStatus.COMPLETED, asset, false, List.of()));

            mockMvc.perform(post("/api/v1/uploads/{id}/complete", sessionId)
                            .header(TENANT_HEADER, TENANT_ID)
                            .header(USER_HEADER, userId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.assetId").value(asset.getId().toString()))
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andExpect(jsonPath("$.alreadyCompleted").value(false));

            ArgumentCaptor<CompleteUploadCommand> command = ArgumentCaptor.forClass(CompleteUploadCommand.class);
            verify(completionService).complete(any(), eq(sessionId), command.capture());
            assertThat(command.getValue().metadata()).isEmpty();
        }

        @Test
        @DisplayName("should map a size mismatch to 422 with both sizes")
        void shouldMapSizeMismatch() throws Exception {
            UUID sessionId = UUID.randomUUID();
            when(completionService.complete(any(), eq(sessionId), any()))
                    .thenThrow(new SizeMismatchException(sessionId, 1024, 1000));

            mockMvc.perform(post("/api/v1/uploads/{id}/complete", sessionId)
                            .header(TENANT_HEADER, TENANT_ID))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("SIZE_MISMATCH"))
                    .andExpect(jsonPath("$.expectedSize").value(1024))
                    .andExpect(jsonPath("$.observedSize").value(1000));
        }

        @Test
        @DisplayName("should map a state conflict to 409")
        void shouldMapStateConflict() throws Exception {
            UUID sessionId = UUID.randomUUID();
            when(completionService.complete(any(), eq(sessionId), any()))
                    .thenThrow(new StateConflictException(sessionId, UploadStatus.CANCELLED, UploadStatus.COMPLETED));

            mockMvc.perform(post("/api/v1/uploads/{id}/complete", sessionId)
                            .header(TENANT_HEADER, TENANT_ID))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.currentStatus").value("CANCELLED"));
        }
    }

    @Test
    @DisplayName("should report an unknown session as 404")
    void shouldMapNotFound() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(lifecycleService.get(any(), eq(sessionId))).thenThrow(new UploadSessionNotFoundException(sessionId));

        mockMvc.perform(get("/api/v1/uploads/{id}", sessionId).header(TENANT_HEADER, TENANT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("should report a repeated cancel as a no-op")
    void shouldCancelIdempotently() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(lifecycleService.cancel(any(), eq(sessionId)))
                .thenReturn(new TransitionOutcome(sessionId, UploadStatus.CANCELLED, false));

        mockMvc.perform(post("/api/v1/uploads/{id}/cancel", sessionId).header(TENANT_HEADER, TENANT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.transitioned").value(false));
    }

    @Test
    @DisplayName("should map every error code to a status")
    void shouldMapEveryCode() {
        for (ErrorCode code : ErrorCode.values()) {
            assertThat(UploadExceptionHandler.statusFor(code)).isNotNull();
        }
        assertThat(UploadExceptionHandler.statusFor(ErrorCode.BUCKET_NOT_READY)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(UploadExceptionHandler.statusFor(ErrorCode.OBJECT_MISSING)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(UploadExceptionHandler.statusFor(ErrorCode.INTERNAL_ERROR)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
