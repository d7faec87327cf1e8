package com.clickermsu.registry.sync;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Where the latest registry backup lives in the external channel.
 */
@Value
@Builder
public class SnapshotPointer {
    long channelId;
    long anchorMessageId;
    String blobId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    Instant recordedAt;
}
