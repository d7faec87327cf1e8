package com.clickermsu.registry.channel;

import com.clickermsu.registry.exception.ChannelException;

/**
 * External message channel used as blob storage for registry backups. A blob lives as a
 * document attached to a message in a chat.
 * <p>
 * Calls block until the channel answers; timeouts belong to the implementation. Every
 * failure is reported as a {@link ChannelException}.
 */
public interface BlobChannel {

    /**
     * Posts {@code content} as a new message in chat {@code channelId}.
     */
    StoredBlob store(long channelId, String fileName, byte[] content);

    /**
     * Swaps the document attached to an existing message. The channel assigns the new
     * content a fresh blob id, returned in the result.
     */
    StoredBlob replace(long channelId, long messageId, String fileName, byte[] content);

    byte[] fetch(String blobId);
}
