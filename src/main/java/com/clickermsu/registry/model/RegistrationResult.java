package com.clickermsu.registry.model;

import com.clickermsu.registry.sync.PushResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a registration. On {@link InsertOutcome#CONFLICT} nothing was written and
 * the ranking lists and backup result are {@code null}.
 */
@Value
@Builder
public class RegistrationResult {
    InsertOutcome outcome;
    List<RankedUser> topUsers;
    List<RankedUser> userRanks;
    PushResult backup;

    public static RegistrationResult conflict() {
        return RegistrationResult.builder()
            .outcome(InsertOutcome.CONFLICT)
            .build();
    }

    public boolean isRegistered() {
        return outcome == InsertOutcome.OK;
    }
}
