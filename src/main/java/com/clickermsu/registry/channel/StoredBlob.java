package com.clickermsu.registry.channel;

import lombok.Value;

/**
 * Channel acknowledgment for a stored blob.
 */
@Value
public class StoredBlob {
    long channelId;
    long messageId;
    String blobId;
}
