package com.clickermsu.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A registered player. {@code userId} is the requester's chat id and is not unique;
 * {@code username} uniqueness is checked by the registry before insert, never by the table.
 */
@Entity
@Table(name = "login_id", indexes = {
    @Index(name = "idx_login_id_id", columnList = "id"),
    @Index(name = "idx_login_id_username", columnList = "username")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRecord {
    // Storage-only row key, the table has no natural primary key
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Long rowId;

    @Column(name = "id", nullable = false)
    private Long userId;

    @Column(name = "username", nullable = false)
    private String username;

    // Stored in clear text
    @Column(name = "password")
    @ToString.Exclude
    private String password;

    public static UserRecord of(long userId, String username, String password) {
        return UserRecord.builder()
            .userId(userId)
            .username(username)
            .password(password)
            .build();
    }
}
