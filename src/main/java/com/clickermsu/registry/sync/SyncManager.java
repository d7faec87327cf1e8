package com.clickermsu.registry.sync;

import com.clickermsu.registry.channel.BlobChannel;
import com.clickermsu.registry.channel.StoredBlob;
import com.clickermsu.registry.exception.ChannelException;
import com.clickermsu.registry.exception.SnapshotDecodeException;
import com.clickermsu.registry.model.UserRecord;
import com.clickermsu.registry.service.RegistryStore;
import com.clickermsu.registry.snapshot.SnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Keeps the remote backup and the local registry in step.
 * <p>
 * A push moves {@code IDLE -> PUSHING -> IDLE}; the pointer changes only once the channel
 * acknowledges the blob, and a failed push is reported, never retried. A pull replaces the
 * registry only after the blob has been fetched and decoded in full.
 */
@Service
public class SyncManager {

    private static final Logger logger = LoggerFactory.getLogger(SyncManager.class);

    private final RegistryStore registryStore;
    private final SnapshotCodec snapshotCodec;
    private final BlobChannel blobChannel;
    private final SnapshotPointerState pointerState;
    private final String snapshotFileName;
    private volatile SyncState state = SyncState.IDLE;

    @Autowired
    public SyncManager(
            RegistryStore registryStore,
            SnapshotCodec snapshotCodec,
            BlobChannel blobChannel,
            SnapshotPointerState pointerState,
            @Value("${snapshot.file-name:registry.json}") String snapshotFileName) {
        this.registryStore = registryStore;
        this.snapshotCodec = snapshotCodec;
        this.blobChannel = blobChannel;
        this.pointerState = pointerState;
        this.snapshotFileName = snapshotFileName;
    }

    /**
     * Pushes the registry as a brand-new blob in chat {@code channelId} and points at it.
     */
    public PushResult save(long channelId) {
        List<UserRecord> snapshot = registryStore.all();
        byte[] blob = snapshotCodec.encodeToBytes(snapshot);

        state = SyncState.PUSHING;
        try {
            StoredBlob stored = blobChannel.store(channelId, snapshotFileName, blob);
            SnapshotPointer next = toPointer(stored.getChannelId(), stored.getMessageId(), stored.getBlobId());
            pointerState.advance(next);
            logger.info("Saved snapshot of {} record(s) as new blob {} in chat {}",
                snapshot.size(), next.getBlobId(), next.getChannelId());
            return PushResult.succeeded(next, snapshot.size());
        } catch (ChannelException e) {
            logger.error("Failed to save snapshot to chat {}", channelId, e);
            return PushResult.failed(pointerState.current(), SyncErrorKind.CHANNEL_ERROR, e.getMessage());
        } finally {
            state = SyncState.IDLE;
        }
    }

    /**
     * Replaces the blob attached to the anchor message of the current pointer.
     */
    public PushResult update() {
        SnapshotPointer pointer = pointerState.current();
        List<UserRecord> snapshot = registryStore.all();
        byte[] blob = snapshotCodec.encodeToBytes(snapshot);

        state = SyncState.PUSHING;
        try {
            StoredBlob stored = blobChannel.replace(
                pointer.getChannelId(), pointer.getAnchorMessageId(), snapshotFileName, blob);
            SnapshotPointer next = toPointer(pointer.getChannelId(), pointer.getAnchorMessageId(), stored.getBlobId());
            pointerState.advance(next);
            logger.info("Updated snapshot of {} record(s) at message {} in chat {}, blob {}",
                snapshot.size(), next.getAnchorMessageId(), next.getChannelId(), next.getBlobId());
            return PushResult.succeeded(next, snapshot.size());
        } catch (ChannelException e) {
            logger.error("Failed to update snapshot at message {} in chat {}",
                pointer.getAnchorMessageId(), pointer.getChannelId(), e);
            return PushResult.failed(pointer, SyncErrorKind.CHANNEL_ERROR, e.getMessage());
        } finally {
            state = SyncState.IDLE;
        }
    }

    /**
     * Replaces the registry with the snapshot at the current pointer.
     */
    public PullResult restore() {
        SnapshotPointer pointer = pointerState.current();
        if (pointer.getBlobId() == null || pointer.getBlobId().isBlank()) {
            logger.warn("No snapshot blob to restore from, pointer has no blob id");
            return PullResult.failed(pointer, SyncErrorKind.CHANNEL_ERROR, "Snapshot pointer has no blob id");
        }

        List<UserRecord> snapshot;
        try {
            byte[] blob = blobChannel.fetch(pointer.getBlobId());
            snapshot = snapshotCodec.decode(blob);
        } catch (ChannelException e) {
            logger.error("Failed to fetch snapshot blob {}", pointer.getBlobId(), e);
            return PullResult.failed(pointer, SyncErrorKind.CHANNEL_ERROR, e.getMessage());
        } catch (SnapshotDecodeException e) {
            logger.error("Snapshot blob {} is malformed", pointer.getBlobId(), e);
            return PullResult.failed(pointer, SyncErrorKind.DECODE_ERROR, e.getMessage());
        }

        registryStore.replaceAll(snapshot);
        logger.info("Restored {} record(s) from snapshot blob {}", snapshot.size(), pointer.getBlobId());
        return PullResult.succeeded(pointer, snapshot.size());
    }

    public SnapshotPointer currentPointer() {
        return pointerState.current();
    }

    public SyncState getState() {
        return state;
    }

    private SnapshotPointer toPointer(long channelId, long messageId, String blobId) {
        return SnapshotPointer.builder()
            .channelId(channelId)
            .anchorMessageId(messageId)
            .blobId(blobId)
            .recordedAt(Instant.now())
            .build();
    }
}
