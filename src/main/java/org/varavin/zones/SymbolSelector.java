package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.Outcome;
import org.varavin.zones.entity.Settings;
import org.varavin.zones.entity.Signal;
import org.varavin.zones.entity.SymbolStats;
import org.varavin.zones.series.CandleSeries;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Отбор активов по их собственной точности на скользящем окне истории перед днём прогноза.
 * История обрезается на начале дня прогноза, так что заглянуть вперёд невозможно.
 */
public final class SymbolSelector {
    private static final Logger log = LoggerFactory.getLogger(SymbolSelector.class);

    static final Comparator<SymbolStats> RANKING = Comparator
            .comparingDouble(SymbolStats::accuracy).reversed()
            .thenComparing(Comparator.comparingInt(SymbolStats::evaluated).reversed())
            .thenComparing(SymbolStats::symbol);

    public record Selection(List<String> symbols, boolean fallback, List<SymbolStats> ranking) {
        public Selection {
            symbols = List.copyOf(symbols);
            ranking = List.copyOf(ranking);
        }
    }

    private SymbolSelector() {
    }

    public static Selection select(RunContext ctx, LocalDate predictionDay) {
        Settings s = ctx.settings();
        Instant cutoff = CandleSeries.startOf(predictionDay);
        Instant from = cutoff.minus(Duration.ofHours(s.selectionLookbackHours()));

        List<SymbolStats> qualified = new ArrayList<>();
        List<SymbolStats> all = new ArrayList<>();
        for (String symbol : ctx.symbols()) {
            SymbolStats stats = historicalStats(ctx, ctx.series(symbol), from, cutoff);
            all.add(stats);
            if (stats.evaluated() >= s.minHistSignals() && stats.accuracy() >= s.minHistAccuracy()) {
                qualified.add(stats);
            }
        }
        qualified.sort(RANKING);
        all.sort(RANKING);

        if (qualified.isEmpty()) {
            log.debug("{}: ни один актив не прошёл фильтр истории, берём всю вселенную", predictionDay);
            return new Selection(ctx.symbols(), true, all);
        }
        List<String> top = qualified.stream()
                .limit(s.topK())
                .map(SymbolStats::symbol)
                .toList();
        log.debug("{}: отобраны {}", predictionDay, top);
        return new Selection(top, false, all);
    }

    /**
     * Точность актива на окне [from, cutoff) с трендовым фильтром, по данным строго до cutoff.
     */
    static SymbolStats historicalStats(RunContext ctx, CandleSeries series, Instant from, Instant cutoff) {
        CandleSeries history = series.slice(Instant.MIN, cutoff);
        Duration step = Duration.ofMinutes(ctx.settings().stepMinutes());
        List<Outcome> outcomes = new ArrayList<>();
        if (!history.isEmpty() && from.isBefore(cutoff)) {
            LocalDate firstDay = CandleSeries.dayOf(from);
            LocalDate lastDay = CandleSeries.dayOf(cutoff.minusNanos(1));
            for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
                for (Signal signal : SignalGenerator.generate(ctx, history, day, from, cutoff, true)) {
                    outcomes.add(OutcomeEvaluator.evaluate(history, signal, step));
                }
            }
        }
        return SymbolStats.of(series.symbol(), outcomes);
    }
}
