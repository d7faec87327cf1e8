package com.clickermsu.registry.sync;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PullResult {
    boolean success;
    SnapshotPointer pointer;
    int recordCount;
    SyncErrorKind errorKind;
    String errorMessage;

    public static PullResult succeeded(SnapshotPointer pointer, int recordCount) {
        return new PullResult(true, pointer, recordCount, null, null);
    }

    public static PullResult failed(SnapshotPointer pointer, SyncErrorKind errorKind, String errorMessage) {
        return new PullResult(false, pointer, 0, errorKind, errorMessage);
    }
}
