package com.assetvault.upload.controller;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.entity.dto.BatchItemResult;
import com.assetvault.upload.entity.dto.CompleteUploadCommand;
import com.assetvault.upload.entity.dto.CompletionResult;
import com.assetvault.upload.entity.dto.InitiateUploadCommand;
import com.assetvault.upload.entity.dto.InitiationResult;
import com.assetvault.upload.entity.dto.MultipartInitiation;
import com.assetvault.upload.entity.dto.PartUploadUrl;
import com.assetvault.upload.entity.dto.TransitionOutcome;
import com.assetvault.upload.entity.dto.UploadContext;
import com.assetvault.upload.service.MultipartUploadService;
import com.assetvault.upload.service.UploadCompletionService;
import com.assetvault.upload.service.UploadInitiationService;
import com.assetvault.upload.service.UploadLifecycleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/uploads")
@RequiredArgsConstructor
public class UploadController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String BRAND_HEADER = "X-Brand-Id";
    static final String USER_HEADER = "X-User-Id";

    private final UploadInitiationService initiationService;
    private final MultipartUploadService multipartService;
    private final UploadCompletionService completionService;
    private final UploadLifecycleService lifecycleService;

    // DTOs
    public record InitiateRequest(
            @NotBlank String fileName,
            @Positive long fileSize,
            String mimeType,
            String clientReference
    ) {
        InitiateUploadCommand toCommand() {
            return InitiateUploadCommand.create(fileName, fileSize, mimeType, clientReference);
        }
    }

    public record BatchInitiateRequest(@NotEmpty List<@Valid InitiateRequest> files) {}

    public record BatchInitiateResponse(List<BatchItemResult> uploads) {}

    public record CompleteRequest(String fileName, String title, UUID categoryId, Map<String, Object> metadata) {}

    public record CompletionResponse(UUID uploadSessionId, String status, UUID assetId, String title,
                                     long sizeBytes, boolean alreadyCompleted, List<String> rejectedMetadataFields) {
        static CompletionResponse of(CompletionResult result) {
            Asset asset = result.asset();
            return new CompletionResponse(result.uploadSessionId(), result.sessionStatus().name(), asset.getId(),
                    asset.getTitle(), asset.getSizeBytes(), result.alreadyCompleted(), result.rejectedMetadataFields());
        }
    }

    public record SessionResponse(UUID uploadSessionId, String clientReference, String status, String uploadType,
                                  String mode, long expectedSize, Long uploadedSize, String multipartUploadId,
                                  Instant expiresAt, Instant lastActivityAt, String failureReason) {
        static SessionResponse of(UploadSession s) {
            return new SessionResponse(s.getId(), s.getClientReference(), s.getStatus().name(), s.getType().name(),
                    s.getMode().name(), s.getExpectedSize(), s.getUploadedSize(), s.getMultipartUploadId(),
                    s.getExpiresAt(), s.getLastActivityAt(),
                    s.getFailureReason() != null ? s.getFailureReason().name() : null);
        }
    }

    @PostMapping
    public ResponseEntity<InitiationResult> initiate(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                     @RequestHeader(value = BRAND_HEADER, required = false) UUID brandId,
                                                     @RequestHeader(value = USER_HEADER, required = false) UUID userId,
                                                     @Valid @RequestBody InitiateRequest req) {
        var result = initiationService.initiate(new UploadContext(tenantId, brandId, userId), req.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchInitiateResponse> initiateBatch(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                               @RequestHeader(value = BRAND_HEADER, required = false) UUID brandId,
                                                               @RequestHeader(value = USER_HEADER, required = false) UUID userId,
                                                               @Valid @RequestBody BatchInitiateRequest req) {
        var commands = req.files().stream().map(InitiateRequest::toCommand).toList();
        var results = initiationService.initiateBatch(new UploadContext(tenantId, brandId, userId), commands);
        return ResponseEntity.ok(new BatchInitiateResponse(results));
    }

    @PostMapping("/replace/{assetId}")
    public ResponseEntity<InitiationResult> initiateReplace(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                            @RequestHeader(value = BRAND_HEADER, required = false) UUID brandId,
                                                            @RequestHeader(value = USER_HEADER, required = false) UUID userId,
                                                            @PathVariable("assetId") UUID assetId,
                                                            @Valid @RequestBody InitiateRequest req) {
        var result = initiationService.initiateReplace(new UploadContext(tenantId, brandId, userId), assetId, req.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> get(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                               @PathVariable("sessionId") UUID sessionId) {
        var session = lifecycleService.get(new UploadContext(tenantId, null, null), sessionId);
        return ResponseEntity.ok(SessionResponse.of(session));
    }

    @PostMapping("/{sessionId}/multipart")
    public ResponseEntity<MultipartInitiation> initiateMultipart(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                                 @PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(multipartService.initiateMultipart(new UploadContext(tenantId, null, null), sessionId));
    }

    @GetMapping("/{sessionId}/parts/{partNumber}")
    public ResponseEntity<PartUploadUrl> partUrl(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                 @PathVariable("sessionId") UUID sessionId,
                                                 @PathVariable("partNumber") int partNumber) {
        return ResponseEntity.ok(multipartService.signPartUrl(new UploadContext(tenantId, null, null), sessionId, partNumber));
    }

    @PostMapping("/{sessionId}/start")
    public ResponseEntity<TransitionOutcome> start(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                   @PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(lifecycleService.markUploading(new UploadContext(tenantId, null, null), sessionId));
    }

    @PostMapping("/{sessionId}/activity")
    public ResponseEntity<SessionResponse> activity(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                    @PathVariable("sessionId") UUID sessionId) {
        var session = lifecycleService.touch(new UploadContext(tenantId, null, null), sessionId);
        return ResponseEntity.ok(SessionResponse.of(session));
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<TransitionOutcome> cancel(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                    @PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(lifecycleService.cancel(new UploadContext(tenantId, null, null), sessionId));
    }

    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<CompletionResponse> complete(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                       @RequestHeader(value = BRAND_HEADER, required = false) UUID brandId,
                                                       @RequestHeader(value = USER_HEADER, required = false) UUID userId,
                                                       @PathVariable("sessionId") UUID sessionId,
                                                       @RequestBody(required = false) CompleteRequest req) {
        var command = req == null
                ? CompleteUploadCommand.empty()
                : new CompleteUploadCommand(req.fileName(), req.title(), req.categoryId(), req.metadata());
        var result = completionService.complete(new UploadContext(tenantId, brandId, userId), sessionId, command);
        return ResponseEntity.ok(CompletionResponse.of(result));
    }

    @PostMapping("/{sessionId}/complete-replace")
    public ResponseEntity<CompletionResponse> completeReplace(@RequestHeader(TENANT_HEADER) UUID tenantId,
                                                              @RequestHeader(value = BRAND_HEADER, required = false) UUID brandId,
                                                              @RequestHeader(value = USER_HEADER, required = false) UUID userId,
                                                              @PathVariable("sessionId") UUID sessionId) {
        var result = completionService.completeReplace(new UploadContext(tenantId, brandId, userId), sessionId);
        return ResponseEntity.ok(CompletionResponse.of(result));
    }
}
