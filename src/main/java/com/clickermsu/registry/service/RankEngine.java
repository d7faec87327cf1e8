package com.clickermsu.registry.service;

import com.clickermsu.registry.model.RankedUser;
import com.clickermsu.registry.model.UserRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks a registry snapshot by descending user id: the largest id is rank 1.
 * Records with equal ids keep their snapshot order.
 */
@Component
public class RankEngine {

    private static final Comparator<UserRecord> BY_USER_ID_DESC =
        Comparator.comparing(UserRecord::getUserId, Comparator.reverseOrder());

    public List<RankedUser> topN(List<UserRecord> snapshot, int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }

        List<RankedUser> ranked = rankAll(snapshot);
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }

    /**
     * Every record named {@code username} with its position in the full ranking. Empty when
     * the username is not registered.
     */
    public List<RankedUser> rankOf(List<UserRecord> snapshot, String username) {
        return rankAll(snapshot).stream()
            .filter(rankedUser -> rankedUser.getUsername().equals(username))
            .toList();
    }

    private List<RankedUser> rankAll(List<UserRecord> snapshot) {
        List<UserRecord> sorted = snapshot.stream()
            .sorted(BY_USER_ID_DESC)
            .toList();

        List<RankedUser> rankedUsers = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            UserRecord record = sorted.get(i);
            rankedUsers.add(RankedUser.builder()
                .rank(i + 1)
                .userId(record.getUserId())
                .username(record.getUsername())
                .build());
        }
        return rankedUsers;
    }
}
