package com.example.battlecore.combat;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One immutable record in the battle log.
 *
 * @param turn      turn number when the event happened
 * @param phase     phase when the event happened
 * @param actorId   participant id, or {@link #SYSTEM_ACTOR} for engine events
 * @param action    short label ("Attack", "Phase Advanced", ...)
 * @param targetIds participants the event touched; null ids are dropped
 * @param result    human-readable outcome
 * @param timestamp when it was recorded
 */
public record BattleLogEntry(int turn, BattlePhase phase, String actorId, String action,
                             List<String> targetIds, String result, Instant timestamp) {

    public static final String SYSTEM_ACTOR = "System";

    public BattleLogEntry {
        targetIds = targetIds == null ? List.of()
            : targetIds.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
        actorId = actorId == null ? SYSTEM_ACTOR : actorId;
        result = result == null ? "" : result;
    }

    public boolean isFrom(String actor) {
        return actor != null && actorId.equalsIgnoreCase(actor.trim());
    }

    @Override
    public String toString() {
        return String.format("[T%d %s] %s: %s - %s", turn, phase.getDisplayName(), actorId, action, result);
    }
}
