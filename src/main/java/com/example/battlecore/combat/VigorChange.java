package com.example.battlecore.combat;

/**
 * Outcome of a direct vigor update.
 */
public record VigorChange(String participantId, int oldVigor, int newVigor, boolean defeated, String reason) {

    public int change() {
        return newVigor - oldVigor;
    }
}
