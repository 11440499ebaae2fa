package com.example.battlecore.model;

/**
 * Grid position on a battlefield.
 */
public record Position(int x, int y) {

    public static final Position ORIGIN = new Position(0, 0);
}
