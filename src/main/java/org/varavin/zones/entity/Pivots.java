package org.varavin.zones.entity;

import java.util.List;

/**
 * Сырые цены локальных экстремумов: максимумы (сопротивления) и минимумы (поддержки).
 */
public record Pivots(List<Double> resistances, List<Double> supports) {

    public Pivots {
        resistances = List.copyOf(resistances);
        supports = List.copyOf(supports);
    }
}
