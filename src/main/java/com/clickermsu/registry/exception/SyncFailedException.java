package com.clickermsu.registry.exception;

import com.clickermsu.registry.sync.SyncErrorKind;

/**
 * Raised by commands that cannot proceed because pulling the remote snapshot failed.
 * Nothing has been written to the registry when this is thrown.
 */
public class SyncFailedException extends RegistryException {
    public SyncFailedException(SyncErrorKind errorKind, String message) {
        super(message, "SYNC_FAILED", errorKind, null);
    }

    public SyncErrorKind getErrorKind() {
        return getSyncErrorKind();
    }
}
