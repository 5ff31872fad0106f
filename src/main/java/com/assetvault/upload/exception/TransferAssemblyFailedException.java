package com.assetvault.upload.exception;

/**
 * Multipart assembly could not produce the object. A {@code terminal} failure means the
 * transfer is gone upstream (aborted or expired) and the session cannot be completed.
 */
public class TransferAssemblyFailedException extends UploadException {

    private final boolean terminal;

    public TransferAssemblyFailedException(String message, boolean terminal) {
        super(ErrorCode.TRANSFER_ASSEMBLY_FAILED, false, message);
        this.terminal = terminal;
    }

    public TransferAssemblyFailedException(String message, boolean terminal, Throwable cause) {
        super(ErrorCode.TRANSFER_ASSEMBLY_FAILED, false, message, cause);
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
