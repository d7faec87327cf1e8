package com.clickermsu.registry.repository.impl;

import com.clickermsu.registry.exception.RegistryException;
import com.clickermsu.registry.model.UserRecord;
import com.clickermsu.registry.repository.UserRecordRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the whole table in memory and rewrites {@code users.json} on every change.
 */
@Repository
@ConditionalOnProperty(name = "registry.storage.type", havingValue = "json")
public class JsonUserRecordRepository implements UserRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonUserRecordRepository.class);
    private static final String USERS_FILE = "users.json";

    private final String dataDirectory;
    private final ObjectMapper objectMapper;
    private final List<UserRecord> records = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public JsonUserRecordRepository(@Value("${registry.storage.directory:./data}") String dataDirectory) {
        this.dataDirectory = dataDirectory;
        this.objectMapper = new ObjectMapper();
        initializeDirectory();
        loadRecords();
    }

    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw RegistryException.storageFailure("Failed to create data directory: " + dataDirectory, e);
        }
    }

    private void loadRecords() {
        File usersFile = new File(dataDirectory, USERS_FILE);
        if (!usersFile.exists()) {
            return;
        }

        try {
            List<UserRecord> loaded = objectMapper.readValue(
                usersFile,
                new TypeReference<List<UserRecord>>() {}
            );

            if (loaded == null) {
                return;
            }

            loaded.stream()
                .filter(Objects::nonNull)
                .filter(record -> record.getUserId() != null && record.getUsername() != null)
                .forEach(records::add);
            logger.info("Loaded {} user records from {}", records.size(), usersFile);
        } catch (IOException e) {
            // Unreadable file: start empty, the next restore or registration rewrites it
            logger.error("Failed to load user records from file: {}", usersFile, e);
        }
    }

    private void persistRecords() {
        File usersFile = new File(dataDirectory, USERS_FILE);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(usersFile, records);
        } catch (IOException e) {
            throw RegistryException.storageFailure("Failed to save user records to file", e);
        }
    }

    @Override
    public UserRecord save(UserRecord userRecord) {
        validateUserRecord(userRecord);

        lock.lock();
        try {
            UserRecord copy = copyUserRecord(userRecord);
            records.add(copy);
            persistRecords();
            return copyUserRecord(copy);
        } finally {
            lock.unlock();
        }
    }

    private void validateUserRecord(UserRecord userRecord) {
        if (userRecord == null) {
            throw new IllegalArgumentException("UserRecord cannot be null");
        }
        if (userRecord.getUserId() == null) {
            throw new IllegalArgumentException("UserId cannot be null");
        }
        if (userRecord.getUsername() == null) {
            throw new IllegalArgumentException("Username cannot be null");
        }
    }

    @Override
    public Optional<UserRecord> findFirstByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }

        lock.lock();
        try {
            return records.stream()
                .filter(record -> username.equals(record.getUsername()))
                .findFirst()
                .map(this::copyUserRecord);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<UserRecord> findFirstByUserId(long userId) {
        lock.lock();
        try {
            return records.stream()
                .filter(record -> record.getUserId() == userId)
                .findFirst()
                .map(this::copyUserRecord);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deleteAllByUserId(long userId) {
        lock.lock();
        try {
            int before = records.size();
            records.removeIf(record -> record.getUserId() == userId);
            int removed = before - records.size();
            if (removed > 0) {
                persistRecords();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<UserRecord> findAll() {
        lock.lock();
        try {
            return records.stream()
                .map(this::copyUserRecord)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void replaceAll(List<UserRecord> userRecords) {
        if (userRecords == null) {
            throw new IllegalArgumentException("UserRecords cannot be null");
        }
        userRecords.forEach(this::validateUserRecord);

        lock.lock();
        try {
            records.clear();
            userRecords.stream()
                .map(this::copyUserRecord)
                .forEach(records::add);
            persistRecords();
        } finally {
            lock.unlock();
        }
    }

    private UserRecord copyUserRecord(UserRecord record) {
        // Row keys are a JPA concern only
        return UserRecord.of(record.getUserId(), record.getUsername(), record.getPassword());
    }
}
