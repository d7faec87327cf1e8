package com.clickermsu.registry.service;

import com.clickermsu.registry.exception.InvalidRequestException;
import com.clickermsu.registry.exception.SyncFailedException;
import com.clickermsu.registry.model.DeleteOutcome;
import com.clickermsu.registry.model.InboundMessage;
import com.clickermsu.registry.model.InsertOutcome;
import com.clickermsu.registry.model.RankedUser;
import com.clickermsu.registry.model.RegistrationResult;
import com.clickermsu.registry.model.SignInResult;
import com.clickermsu.registry.model.TopUsers;
import com.clickermsu.registry.model.UploadReceipt;
import com.clickermsu.registry.model.UserRecord;
import com.clickermsu.registry.sync.PullResult;
import com.clickermsu.registry.sync.PushResult;
import com.clickermsu.registry.sync.SnapshotPointer;
import com.clickermsu.registry.sync.SyncManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Command layer over the registry. Commands run one at a time under a single lock, so a
 * pull, the mutation and the following push are never interleaved with another command.
 */
@Service
public class RegistryService {

    private static final Logger logger = LoggerFactory.getLogger(RegistryService.class);

    // Registrations not initiated from a chat carry no requester id
    private static final long ANONYMOUS_USER_ID = 0L;

    private final RegistryStore registryStore;
    private final RankEngine rankEngine;
    private final SyncManager syncManager;
    private final int topLimit;
    private final int maxTopLimit;
    private final ReentrantLock commandLock = new ReentrantLock(true);

    @Autowired
    public RegistryService(
            RegistryStore registryStore,
            RankEngine rankEngine,
            SyncManager syncManager,
            @Value("${registry.top.default-limit:10}") int topLimit,
            @Value("${registry.top.max-limit:1000}") int maxTopLimit) {
        this.registryStore = registryStore;
        this.rankEngine = rankEngine;
        this.syncManager = syncManager;
        this.topLimit = topLimit;
        this.maxTopLimit = maxTopLimit;
    }

    /**
     * Register a new user.
     * Refreshes the registry from the latest backup first, then inserts, then pushes the
     * new registry over the current backup. A failed push does not undo the insert.
     */
    public RegistrationResult register(Long userId, String username, String password) {
        validateCredentials(username, password);
        long requesterId = userId != null ? userId : ANONYMOUS_USER_ID;

        return serialized(() -> {
            pullOrFail("register");

            InsertOutcome outcome = registryStore.insert(requesterId, username, password);
            if (outcome == InsertOutcome.CONFLICT) {
                return RegistrationResult.conflict();
            }

            PushResult backup = syncManager.update();
            if (!backup.isSuccess()) {
                logger.warn("User {} registered but the backup was not updated: {}", username, backup.getErrorMessage());
            }

            List<UserRecord> snapshot = registryStore.all();
            List<RankedUser> topUsers = rankEngine.topN(snapshot, topLimit);
            List<RankedUser> userRanks = rankEngine.rankOf(snapshot, username);
            logger.debug("User {} ranked {} among {} users", username, userRanks, snapshot.size());

            return RegistrationResult.builder()
                .outcome(InsertOutcome.OK)
                .topUsers(topUsers)
                .userRanks(userRanks)
                .backup(backup)
                .build();
        });
    }

    /**
     * Check credentials against the registry, refreshed from the latest backup.
     */
    public SignInResult signIn(String username, String password) {
        validateCredentials(username, password);

        return serialized(() -> {
            pullOrFail("sign-in");

            Optional<UserRecord> record = registryStore.findByUsername(username);
            if (record.isEmpty()) {
                logger.info("Sign-in for unregistered user {}", username);
                return SignInResult.notRegistered();
            }

            boolean passwordMatches = password.equals(record.get().getPassword());
            if (!passwordMatches) {
                logger.info("Sign-in for user {} with wrong password", username);
            }
            return new SignInResult(true, passwordMatches);
        });
    }

    public DeleteOutcome delete(Long userId) {
        if (userId == null) {
            throw new InvalidRequestException("UserId cannot be null");
        }

        return serialized(() -> {
            DeleteOutcome outcome = registryStore.deleteById(userId);
            if (!outcome.isDeleted()) {
                logger.warn("No user with id {} to delete", userId);
            }
            return outcome;
        });
    }

    /**
     * Push the registry as a new backup in chat {@code chatId} and make it the current one.
     */
    public PushResult save(Long chatId) {
        if (chatId == null) {
            throw new InvalidRequestException("ChatId cannot be null");
        }
        return serialized(() -> syncManager.save(chatId));
    }

    /**
     * Push the registry over the current backup.
     */
    public PushResult update() {
        return serialized(syncManager::update);
    }

    public PullResult restore() {
        return serialized(syncManager::restore);
    }

    public UploadReceipt receiveUpload(InboundMessage message) {
        if (message == null || message.getChatId() == null) {
            throw new InvalidRequestException("Message must carry a chat id");
        }
        if (message.getDocumentFileId() == null || message.getDocumentFileId().isBlank()) {
            throw new InvalidRequestException("Message carries no document");
        }

        logger.info("Received document {} in chat {}", message.getDocumentFileId(), message.getChatId());
        return new UploadReceipt(message.getChatId(), message.getMessageId(), message.getDocumentFileId());
    }

    /**
     * Top {@code limit} users and the total count, both read under one lock so they agree.
     */
    public TopUsers getTopUsers(int limit) {
        if (limit <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
        if (limit > maxTopLimit) {
            throw new InvalidRequestException("Limit cannot exceed " + maxTopLimit);
        }
        return serialized(() -> {
            List<UserRecord> snapshot = registryStore.all();
            return new TopUsers(rankEngine.topN(snapshot, limit), snapshot.size());
        });
    }

    public List<RankedUser> getRank(String username) {
        if (username == null || username.isEmpty()) {
            throw new InvalidRequestException("Username cannot be null or empty");
        }
        return serialized(() -> rankEngine.rankOf(registryStore.all(), username));
    }

    public SnapshotPointer currentPointer() {
        return syncManager.currentPointer();
    }

    private void pullOrFail(String command) {
        PullResult pull = syncManager.restore();
        if (!pull.isSuccess()) {
            logger.error("Aborting {}: could not refresh registry from backup ({}: {})",
                command, pull.getErrorKind(), pull.getErrorMessage());
            throw new SyncFailedException(pull.getErrorKind(), "Could not refresh registry from backup: " + pull.getErrorMessage());
        }
    }

    private void validateCredentials(String username, String password) {
        if (username == null || username.trim().isEmpty()) {
            throw new InvalidRequestException("Username cannot be null or empty");
        }
        if (password == null) {
            throw new InvalidRequestException("Password cannot be null");
        }
    }

    private <T> T serialized(Supplier<T> command) {
        commandLock.lock();
        try {
            return command.get();
        } finally {
            commandLock.unlock();
        }
    }
}
