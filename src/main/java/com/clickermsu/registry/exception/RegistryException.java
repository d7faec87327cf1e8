package com.clickermsu.registry.exception;

import com.clickermsu.registry.sync.SyncErrorKind;

/**
 * Root of every failure the registry reports. {@code errorCode} is what clients see in error
 * responses; {@code syncErrorKind} is set only for failures of the backup channel or codec.
 */
public class RegistryException extends RuntimeException {
    public static final String STORAGE_ERROR = "STORAGE_ERROR";

    private final String errorCode;
    private final SyncErrorKind syncErrorKind;

    protected RegistryException(String message, String errorCode) {
        this(message, errorCode, null, null);
    }

    protected RegistryException(String message, String errorCode, SyncErrorKind syncErrorKind, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.syncErrorKind = syncErrorKind;
    }

    /**
     * The local record store could not be read or written.
     */
    public static RegistryException storageFailure(String message, Throwable cause) {
        return new RegistryException(message, STORAGE_ERROR, null, cause);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public SyncErrorKind getSyncErrorKind() {
        return syncErrorKind;
    }
}
