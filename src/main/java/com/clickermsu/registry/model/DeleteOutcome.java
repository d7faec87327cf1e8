package com.clickermsu.registry.model;

import lombok.Value;

/**
 * Result of deleting by user id. Every record carrying the id is removed, so
 * {@code deletedCount} may exceed one.
 */
@Value
public class DeleteOutcome {
    long userId;
    int deletedCount;

    public static DeleteOutcome of(long userId, int deletedCount) {
        return new DeleteOutcome(userId, deletedCount);
    }

    public boolean isDeleted() {
        return deletedCount > 0;
    }
}
