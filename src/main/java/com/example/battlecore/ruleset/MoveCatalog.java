package com.example.battlecore.ruleset;

import com.example.battlecore.combat.MoveData;

import java.util.List;

/**
 * Supplies move metadata when an attack is submitted by move name only.
 */
public interface MoveCatalog {

    /** Catalog that knows no moves */
    MoveCatalog EMPTY = new MoveCatalog() {
        @Override
        public MoveData findMove(String name) {
            return null;
        }

        @Override
        public List<MoveData> allMoves() {
            return List.of();
        }
    };

    /**
     * Look up a move by name (case-insensitive).
     * @return the move, or null if unknown
     */
    MoveData findMove(String name);

    List<MoveData> allMoves();
}
