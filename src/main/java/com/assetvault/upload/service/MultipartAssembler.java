package com.assetvault.upload.service;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.exception.TransferAssemblyFailedException;
import com.assetvault.upload.storage.ObjectStat;
import com.assetvault.upload.storage.ObjectStoreGateway;
import com.assetvault.upload.storage.ObjectStoreRejectedException;
import com.assetvault.upload.storage.TransferNotFoundException;
import com.assetvault.upload.storage.UploadedPart;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Completes a multipart transfer from the parts the store holds for it.
 *
 * <p>A transfer the store no longer knows may have been completed by an earlier attempt;
 * the object's presence decides between success and a terminal failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultipartAssembler {

    private final ObjectStoreGateway objectStore;

    public void assemble(UploadSession session, String bucket) {
        String transferId = session.getMultipartUploadId();
        if (transferId == null) {
            throw new TransferAssemblyFailedException(
                    "Multipart upload was never initiated for session " + session.getId(), false);
        }
        String key = session.objectKey();

        List<UploadedPart> parts;
        try {
            parts = objectStore.listParts(bucket, key, transferId);
        } catch (TransferNotFoundException e) {
            confirmAlreadyAssembled(session, bucket, e);
            return;
        }
        if (parts.isEmpty()) {
            throw new TransferAssemblyFailedException(
                    "No parts have been uploaded for session " + session.getId(), false);
        }

        List<UploadedPart> ordered = parts.stream()
                .sorted(Comparator.comparingInt(UploadedPart::partNumber))
                .toList();
        try {
            objectStore.completeMultipart(bucket, key, transferId, ordered);
        } catch (TransferNotFoundException e) {
            confirmAlreadyAssembled(session, bucket, e);
            return;
        } catch (ObjectStoreRejectedException e) {
            throw new TransferAssemblyFailedException(
                    "Object store rejected multipart completion for session " + session.getId()
                            + ": " + e.getMessage(), false, e);
        }
        log.info("[Upload Lifecycle] Multipart upload assembled: uploadSessionId={}, parts={}",
                session.getId(), ordered.size());
    }

    private void confirmAlreadyAssembled(UploadSession session, String bucket, TransferNotFoundException cause) {
        ObjectStat stat = objectStore.stat(bucket, session.objectKey());
        if (stat.exists()) {
            log.info("Multipart upload already completed upstream: uploadSessionId={}, multipartUploadId={}",
                    session.getId(), session.getMultipartUploadId());
            return;
        }
        throw new TransferAssemblyFailedException("Multipart upload " + session.getMultipartUploadId()
                + " was aborted or expired and no object exists for session " + session.getId(), true, cause);
    }
}
