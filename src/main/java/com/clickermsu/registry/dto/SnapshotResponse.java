package com.clickermsu.registry.dto;

import com.clickermsu.registry.sync.PullResult;
import com.clickermsu.registry.sync.PushResult;
import com.clickermsu.registry.sync.SnapshotPointer;
import com.clickermsu.registry.sync.SyncErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a save, update or restore, with the pointer that is live afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotResponse {
    private boolean success;
    private SnapshotPointer pointer;
    private Integer recordCount;
    private SyncErrorKind errorKind;
    private String errorMessage;

    public static SnapshotResponse from(PushResult result) {
        return SnapshotResponse.builder()
            .success(result.isSuccess())
            .pointer(result.getPointer())
            .recordCount(result.isSuccess() ? result.getRecordCount() : null)
            .errorKind(result.getErrorKind())
            .errorMessage(result.getErrorMessage())
            .build();
    }

    public static SnapshotResponse from(PullResult result) {
        return SnapshotResponse.builder()
            .success(result.isSuccess())
            .pointer(result.getPointer())
            .recordCount(result.isSuccess() ? result.getRecordCount() : null)
            .errorKind(result.getErrorKind())
            .errorMessage(result.getErrorMessage())
            .build();
    }

    public static SnapshotResponse of(SnapshotPointer pointer) {
        return SnapshotResponse.builder()
            .success(true)
            .pointer(pointer)
            .build();
    }
}
