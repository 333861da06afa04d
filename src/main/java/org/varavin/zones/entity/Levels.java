package org.varavin.zones.entity;

import java.util.List;

public record Levels(List<Level> supports, List<Level> resistances) {

    public static final Levels EMPTY = new Levels(List.of(), List.of());

    public Levels {
        supports = List.copyOf(supports);
        resistances = List.copyOf(resistances);
    }

    public boolean isEmpty() {
        return supports.isEmpty() && resistances.isEmpty();
    }
}
