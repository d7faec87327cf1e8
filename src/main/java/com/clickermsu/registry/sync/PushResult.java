package com.clickermsu.registry.sync;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of pushing the registry to the channel. On failure {@code pointer} is the
 * pointer that stayed live, on success the one that replaced it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PushResult {
    boolean success;
    SnapshotPointer pointer;
    int recordCount;
    SyncErrorKind errorKind;
    String errorMessage;

    public static PushResult succeeded(SnapshotPointer pointer, int recordCount) {
        return new PushResult(true, pointer, recordCount, null, null);
    }

    public static PushResult failed(SnapshotPointer unchangedPointer, SyncErrorKind errorKind, String errorMessage) {
        return new PushResult(false, unchangedPointer, 0, errorKind, errorMessage);
    }
}
