package com.example.battlecore.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only record of everything that happened in a battle.
 * Entries are never changed or removed; reads return copies.
 */
public class BattleLog {

    private final List<BattleLogEntry> entries = new ArrayList<>();

    public void append(BattleLogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Log entry is required");
        }
        entries.add(entry);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * All entries, oldest first.
     */
    public List<BattleLogEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * The most recent entry, or null if the log is empty.
     */
    public BattleLogEntry last() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    /**
     * Entries filtered by actor (case-insensitive; blank means any actor), then
     * trimmed to the last {@code count} (0 or less means all).
     */
    public List<BattleLogEntry> query(int count, String actorFilter) {
        List<BattleLogEntry> filtered = entries;
        if (actorFilter != null && !actorFilter.isBlank()) {
            filtered = entries.stream()
                .filter(e -> e.isFrom(actorFilter))
                .collect(Collectors.toList());
        }
        if (count > 0 && filtered.size() > count) {
            filtered = filtered.subList(filtered.size() - count, filtered.size());
        }
        return List.copyOf(filtered);
    }

    public List<BattleLogEntry> recent(int count) {
        return query(count, null);
    }

    public List<BattleLogEntry> byActor(String actorId) {
        return query(0, actorId);
    }

    /**
     * The last {@code lines} entries as text, one per line.
     */
    public String getRecentText(int lines) {
        return recent(lines).stream()
            .map(BattleLogEntry::toString)
            .collect(Collectors.joining("\n"));
    }
}
