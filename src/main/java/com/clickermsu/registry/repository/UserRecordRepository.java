package com.clickermsu.registry.repository;

import com.clickermsu.registry.model.UserRecord;

import java.util.List;
import java.util.Optional;

public interface UserRecordRepository {
    UserRecord save(UserRecord userRecord);
    Optional<UserRecord> findFirstByUsername(String username);
    Optional<UserRecord> findFirstByUserId(long userId);
    int deleteAllByUserId(long userId);
    List<UserRecord> findAll();
    void replaceAll(List<UserRecord> userRecords);
}
