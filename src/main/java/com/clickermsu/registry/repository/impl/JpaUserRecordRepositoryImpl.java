package com.clickermsu.registry.repository.impl;

import com.clickermsu.registry.model.UserRecord;
import com.clickermsu.registry.repository.UserRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "registry.storage.type", havingValue = "jpa", matchIfMissing = true)
public class JpaUserRecordRepositoryImpl implements UserRecordRepository {

    private final JpaUserRecordRepository jpaRepository;

    @Autowired
    public JpaUserRecordRepositoryImpl(JpaUserRecordRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    @Transactional
    public UserRecord save(UserRecord userRecord) {
        return jpaRepository.save(userRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserRecord> findFirstByUsername(String username) {
        return jpaRepository.findFirstByUsernameOrderByRowIdAsc(username);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserRecord> findFirstByUserId(long userId) {
        return jpaRepository.findFirstByUserIdOrderByRowIdAsc(userId);
    }

    @Override
    @Transactional
    public int deleteAllByUserId(long userId) {
        return jpaRepository.deleteAllByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserRecord> findAll() {
        return jpaRepository.findAllByOrderByRowIdAsc();
    }

    @Override
    @Transactional
    public void replaceAll(List<UserRecord> userRecords) {
        jpaRepository.deleteAllInBatch();
        // Fresh row keys, the incoming records may still carry ones from another table
        List<UserRecord> copies = userRecords.stream()
            .map(record -> UserRecord.of(record.getUserId(), record.getUsername(), record.getPassword()))
            .toList();
        jpaRepository.saveAll(copies);
    }
}
