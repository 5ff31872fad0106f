package com.assetvault.upload.storage;

import java.time.Duration;
import java.util.List;

/**
 * Remote object store used for direct and multipart uploads.
 *
 * <p>Network failures and timeouts surface as
 * {@link com.assetvault.upload.exception.RemoteUnavailableException}. Calls are synchronous
 * and bounded by the client's configured timeouts.
 */
public interface ObjectStoreGateway {

    ObjectStat stat(String bucket, String key);

    String presignPut(String bucket, String key, String contentType, Duration ttl);

    String presignPart(String bucket, String key, String transferId, int partNumber, Duration ttl);

    String initiateMultipart(String bucket, String key, String contentType);

    /**
     * @throws TransferNotFoundException when the transfer id is unknown to the store
     */
    List<UploadedPart> listParts(String bucket, String key, String transferId);

    /**
     * @param orderedParts parts sorted by ascending part number
     * @throws TransferNotFoundException when the transfer was already completed or aborted
     * @throws ObjectStoreRejectedException when the store refuses the part list
     */
    void completeMultipart(String bucket, String key, String transferId, List<UploadedPart> orderedParts);

    /**
     * @throws TransferNotFoundException when there is nothing left to abort
     */
    void abortMultipart(String bucket, String key, String transferId);

    void deleteObject(String bucket, String key);

    boolean bucketExists(String bucket);

    void createBucket(String bucket);
}
