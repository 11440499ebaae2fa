package com.example.battlecore.model;

/**
 * Battle weather ("Clear", "Rain", "Sandstorm", ...).
 * The engine only records it; ruleset effect handlers decide what it does.
 */
public class Weather {

    public static final String CLEAR = "Clear";

    private final String name;

    /** Turns left, or null when it lasts until changed */
    private Integer remainingTurns;

    public Weather(String name, Integer remainingTurns) {
        this.name = name == null || name.isBlank() ? CLEAR : name;
        this.remainingTurns = remainingTurns;
    }

    public Weather(String name) {
        this(name, null);
    }

    public String getName() { return name; }

    public Integer getRemainingTurns() { return remainingTurns; }

    public void setRemainingTurns(Integer remainingTurns) { this.remainingTurns = remainingTurns; }

    public boolean isClear() {
        return CLEAR.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
        return remainingTurns == null ? name : name + " (" + remainingTurns + " turns)";
    }
}
