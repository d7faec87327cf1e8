package com.clickermsu.registry.repository.impl;

import com.clickermsu.registry.model.UserRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaUserRecordRepositoryImpl.class)
class JpaUserRecordRepositoryImplTest {

    @Autowired
    private JpaUserRecordRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository.replaceAll(List.of());
    }

    @Test
    void testSaveAssignsRowKeyAndFinds() {
        UserRecord saved = repository.save(UserRecord.of(11, "alice", "pw1"));

        assertNotNull(saved.getRowId());
        assertEquals(UserRecord.of(11, "alice", "pw1"), repository.findFirstByUsername("alice").orElseThrow());
        assertEquals("alice", repository.findFirstByUserId(11).orElseThrow().getUsername());
        assertTrue(repository.findFirstByUsername("bob").isEmpty());
    }

    @Test
    void testFindAll_KeepsInsertionOrder() {
        repository.save(UserRecord.of(3, "carol", "pw3"));
        repository.save(UserRecord.of(1, "alice", "pw1"));
        repository.save(UserRecord.of(5, "bob", "pw2"));

        assertEquals(List.of("carol", "alice", "bob"),
            repository.findAll().stream().map(UserRecord::getUsername).toList());
    }

    @Test
    void testFindFirstByUserId_ReturnsEarliestRecord() {
        repository.save(UserRecord.of(4, "first", "pw"));
        repository.save(UserRecord.of(4, "second", "pw"));

        assertEquals("first", repository.findFirstByUserId(4).orElseThrow().getUsername());
    }

    @Test
    void testDeleteAllByUserId_RemovesEveryMatch() {
        repository.save(UserRecord.of(7, "alice", "pw1"));
        repository.save(UserRecord.of(8, "bob", "pw2"));
        repository.save(UserRecord.of(7, "carol", "pw3"));

        assertEquals(2, repository.deleteAllByUserId(7));
        assertTrue(repository.findFirstByUserId(7).isEmpty());
        assertEquals(List.of(UserRecord.of(8, "bob", "pw2")), repository.findAll());
    }

    @Test
    void testReplaceAll_AllowsDuplicatesAndDropsOldRows() {
        repository.save(UserRecord.of(1, "alice", "pw1"));
        List<UserRecord> snapshot = List.of(
            UserRecord.of(2, "bob", "pw2"),
            UserRecord.of(2, "bob", "pw2"),
            UserRecord.of(6, "dave", "pw6"));

        repository.replaceAll(snapshot);

        assertEquals(snapshot, repository.findAll());
    }

    @Test
    void testReplaceAll_WithRecordsReadFromTheTable() {
        repository.save(UserRecord.of(1, "alice", "pw1"));
        repository.save(UserRecord.of(2, "bob", "pw2"));

        repository.replaceAll(repository.findAll());

        assertEquals(List.of(UserRecord.of(1, "alice", "pw1"), UserRecord.of(2, "bob", "pw2")),
            repository.findAll());
    }
}
