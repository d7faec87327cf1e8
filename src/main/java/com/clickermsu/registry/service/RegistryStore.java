package com.clickermsu.registry.service;

import com.clickermsu.registry.model.DeleteOutcome;
import com.clickermsu.registry.model.InsertOutcome;
import com.clickermsu.registry.model.UserRecord;
import com.clickermsu.registry.repository.UserRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * The durable table of registered users.
 * <p>
 * Username uniqueness is a check-then-insert over the repository, so callers must not
 * run {@link #insert} concurrently; {@link RegistryService} serializes every command.
 */
@Component
public class RegistryStore {

    private static final Logger logger = LoggerFactory.getLogger(RegistryStore.class);

    private final UserRecordRepository userRecordRepository;

    @Autowired
    public RegistryStore(UserRecordRepository userRecordRepository) {
        this.userRecordRepository = userRecordRepository;
    }

    public InsertOutcome insert(long userId, String username, String password) {
        if (userRecordRepository.findFirstByUsername(username).isPresent()) {
            logger.warn("Username {} is already registered", username);
            return InsertOutcome.CONFLICT;
        }

        userRecordRepository.save(UserRecord.of(userId, username, password));
        logger.info("Registered user {} with id {}", username, userId);
        return InsertOutcome.OK;
    }

    public Optional<UserRecord> findByUsername(String username) {
        return userRecordRepository.findFirstByUsername(username);
    }

    public Optional<UserRecord> findById(long userId) {
        return userRecordRepository.findFirstByUserId(userId);
    }

    /**
     * Removes every record carrying {@code userId}.
     */
    public DeleteOutcome deleteById(long userId) {
        if (userRecordRepository.findFirstByUserId(userId).isEmpty()) {
            return DeleteOutcome.of(userId, 0);
        }

        int deleted = userRecordRepository.deleteAllByUserId(userId);
        logger.info("Deleted {} record(s) with id {}", deleted, userId);
        return DeleteOutcome.of(userId, deleted);
    }

    /**
     * Replaces the whole table. The uniqueness check is skipped, snapshots are taken
     * from a table that already enforced it.
     */
    public void replaceAll(List<UserRecord> records) {
        userRecordRepository.replaceAll(records);
        logger.info("Replaced registry contents with {} record(s)", records.size());
    }

    public List<UserRecord> all() {
        return userRecordRepository.findAll();
    }
}
