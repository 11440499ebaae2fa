package com.example.battlecore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Where the battle takes place and the hazards laid on it.
 */
public class Battlefield {

    private final String name;
    private final List<Hazard> hazards = new ArrayList<>();

    public Battlefield(String name) {
        this.name = name == null || name.isBlank() ? "Standard Field" : name;
    }

    public String getName() { return name; }

    public List<Hazard> getHazards() {
        return Collections.unmodifiableList(hazards);
    }

    public void addHazard(Hazard hazard) {
        if (hazard != null) hazards.add(hazard);
    }

    public boolean removeHazard(Hazard hazard) {
        return hazards.remove(hazard);
    }

    public List<Hazard> getHazardsAt(Position position) {
        List<Hazard> out = new ArrayList<>();
        for (Hazard h : hazards) {
            if (h.position().equals(position)) {
                out.add(h);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return name + (hazards.isEmpty() ? "" : " (" + hazards.size() + " hazards)");
    }
}
