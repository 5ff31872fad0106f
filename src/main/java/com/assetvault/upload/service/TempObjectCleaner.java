package com.assetvault.upload.service;

import com.assetvault.upload.entity.UploadSession;
import com.assetvault.upload.storage.ObjectStoreGateway;
import com.assetvault.upload.storage.TransferNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Removes what an abandoned session left in the object store: the temporary object and
 * any open multipart transfer. Never throws; the result says whether everything went.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TempObjectCleaner {

    private final ObjectStoreGateway objectStore;
    private final TenantBucketService bucketService;

    public boolean cleanup(UploadSession session) {
        Optional<String> bucket;
        try {
            bucket = bucketService.findBucketName(session.getStorageBucketId());
        } catch (RuntimeException e) {
            log.warn("Failed to resolve bucket for cleanup: uploadSessionId={}, error={}",
                    session.getId(), e.getMessage());
            return false;
        }
        if (bucket.isEmpty()) {
            log.warn("Skipping cleanup, bucket no longer exists: uploadSessionId={}, storageBucketId={}",
                    session.getId(), session.getStorageBucketId());
            return false;
        }

        boolean clean = abortTransfer(session, bucket.get());
        try {
            objectStore.deleteObject(bucket.get(), session.objectKey());
            log.debug("Deleted temporary upload object: uploadSessionId={}, key={}",
                    session.getId(), session.objectKey());
        } catch (RuntimeException e) {
            log.warn("Failed to delete temporary upload object: uploadSessionId={}, key={}, error={}",
                    session.getId(), session.objectKey(), e.getMessage());
            clean = false;
        }
        return clean;
    }

    private boolean abortTransfer(UploadSession session, String bucket) {
        if (session.getMultipartUploadId() == null) {
            return true;
        }
        try {
            objectStore.abortMultipart(bucket, session.objectKey(), session.getMultipartUploadId());
            log.debug("Aborted multipart upload: uploadSessionId={}, multipartUploadId={}",
                    session.getId(), session.getMultipartUploadId());
            return true;
        } catch (TransferNotFoundException e) {
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to abort multipart upload: uploadSessionId={}, multipartUploadId={}, error={}",
                    session.getId(), session.getMultipartUploadId(), e.getMessage());
            return false;
        }
    }
}
