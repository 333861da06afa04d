package org.varavin.zones.entity;

import java.util.Collection;

/**
 * Итог по одному активу за день. Сигналы без данных (NO_DATA) не входят в точность.
 */
public record SymbolStats(String symbol, int signals, int winsG0, int winsG1, int losses, int noData) {

    public static SymbolStats of(String symbol, Collection<Outcome> outcomes) {
        int g0 = 0, g1 = 0, losses = 0, noData = 0;
        for (Outcome outcome : outcomes) {
            switch (outcome) {
                case WIN_G0 -> g0++;
                case WIN_G1 -> g1++;
                case LOSS -> losses++;
                case NO_DATA -> noData++;
            }
        }
        return new SymbolStats(symbol, outcomes.size(), g0, g1, losses, noData);
    }

    public int wins() {
        return winsG0 + winsG1;
    }

    public int evaluated() {
        return wins() + losses;
    }

    public double accuracy() {
        return evaluated() == 0 ? 0.0 : (double) wins() / evaluated();
    }
}
