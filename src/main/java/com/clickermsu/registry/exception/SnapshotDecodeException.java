package com.clickermsu.registry.exception;

import com.clickermsu.registry.sync.SyncErrorKind;

/**
 * A snapshot blob that is not a JSON array of {@code [id, username, password]} rows.
 */
public class SnapshotDecodeException extends RegistryException {
    public SnapshotDecodeException(String message) {
        this(message, null);
    }

    public SnapshotDecodeException(String message, Throwable cause) {
        super(message, "SNAPSHOT_DECODE_ERROR", SyncErrorKind.DECODE_ERROR, cause);
    }
}
