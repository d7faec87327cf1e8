package com.clickermsu.registry.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single live {@link SnapshotPointer}. Starts from the configured default and is
 * advanced only by {@link SyncManager} after the channel acknowledges a push.
 */
@Component
public class SnapshotPointerState {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotPointerState.class);

    private final AtomicReference<SnapshotPointer> current;

    @Autowired
    public SnapshotPointerState(
            @Value("${snapshot.pointer.default.chat-id:0}") long defaultChatId,
            @Value("${snapshot.pointer.default.message-id:0}") long defaultMessageId,
            @Value("${snapshot.pointer.default.blob-id:}") String defaultBlobId) {
        this(SnapshotPointer.builder()
            .channelId(defaultChatId)
            .anchorMessageId(defaultMessageId)
            .blobId(defaultBlobId)
            .recordedAt(Instant.now())
            .build());
    }

    public SnapshotPointerState(SnapshotPointer initial) {
        this.current = new AtomicReference<>(initial);
        logger.info("Snapshot pointer initialized - chatId: {}, messageId: {}, blobId: {}",
            initial.getChannelId(), initial.getAnchorMessageId(), initial.getBlobId());
    }

    public SnapshotPointer current() {
        return current.get();
    }

    void advance(SnapshotPointer next) {
        SnapshotPointer previous = current.getAndSet(next);
        logger.info("Snapshot pointer advanced - blobId: {} -> {}, messageId: {} -> {}",
            previous.getBlobId(), next.getBlobId(), previous.getAnchorMessageId(), next.getAnchorMessageId());
    }
}
