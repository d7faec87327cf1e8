package com.clickermsu.registry.repository.impl;

import com.clickermsu.registry.model.UserRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaUserRecordRepository extends JpaRepository<UserRecord, Long> {
    Optional<UserRecord> findFirstByUsernameOrderByRowIdAsc(String username);
    Optional<UserRecord> findFirstByUserIdOrderByRowIdAsc(Long userId);
    List<UserRecord> findAllByOrderByRowIdAsc();

    @Modifying
    @Query("delete from UserRecord u where u.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
