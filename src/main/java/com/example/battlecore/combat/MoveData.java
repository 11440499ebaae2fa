package com.example.battlecore.combat;

import com.example.battlecore.model.ElementType;

/**
 * Move metadata an attack needs.
 *
 * @param name          move name, recorded in the attacker's move history
 * @param type          element of the move; null is read as Normal
 * @param numDamageDice d6 rolled on a hit before stat bonus dice, at least 1
 * @param special       special moves use Mind against Spirit instead of Power against Defense
 */
public record MoveData(String name, ElementType type, int numDamageDice, boolean special) {

    public MoveData {
        if (type == null) {
            type = ElementType.NORMAL;
        }
    }

    /**
     * A move can be used when it has a name and at least one damage die.
     */
    public boolean isValid() {
        return name != null && !name.isBlank() && numDamageDice >= 1;
    }
}
