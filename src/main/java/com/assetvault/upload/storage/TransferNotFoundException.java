package com.assetvault.upload.storage;

/**
 * The store no longer knows the multipart transfer: it was completed, aborted or
 * expired on the remote side.
 */
public class TransferNotFoundException extends RuntimeException {

    private final String transferId;

    public TransferNotFoundException(String transferId, Throwable cause) {
        super("Multipart transfer not found: " + transferId, cause);
        this.transferId = transferId;
    }

    public String getTransferId() {
        return transferId;
    }
}
