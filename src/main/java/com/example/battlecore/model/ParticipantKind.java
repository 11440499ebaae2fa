package com.example.battlecore.model;

/**
 * What a participant is and which side it fights for.
 */
public enum ParticipantKind {
    PLAYER_CREATURE("PlayerCreature", true, true),
    ENEMY_CREATURE("EnemyCreature", true, false),
    PLAYER_HANDLER("PlayerHandler", false, true),
    ENEMY_HANDLER("EnemyHandler", false, false);

    private final String displayName;
    private final boolean creature;
    private final boolean playerSide;

    ParticipantKind(String displayName, boolean creature, boolean playerSide) {
        this.displayName = displayName;
        this.creature = creature;
        this.playerSide = playerSide;
    }

    public String getDisplayName() { return displayName; }

    public boolean isCreature() { return creature; }

    public boolean isHandler() { return !creature; }

    public boolean isPlayerSide() { return playerSide; }

    public boolean isEnemySide() { return !playerSide; }

    /**
     * Kind for a creature fighting for the given faction.
     * Faction "Player" (any case) is the player side, everything else the enemy side.
     */
    public static ParticipantKind creatureFor(String faction) {
        return isPlayerFaction(faction) ? PLAYER_CREATURE : ENEMY_CREATURE;
    }

    /**
     * Kind for a handler fighting for the given faction.
     */
    public static ParticipantKind handlerFor(String faction) {
        return isPlayerFaction(faction) ? PLAYER_HANDLER : ENEMY_HANDLER;
    }

    private static boolean isPlayerFaction(String faction) {
        return faction != null && faction.trim().equalsIgnoreCase("player");
    }
}
