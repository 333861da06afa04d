package org.varavin.zones.entity;

import java.time.LocalDate;
import java.util.List;

/**
 * Результат одного опорного дня: сигналы считаются на predictionDay = referenceDay + 1.
 *
 * @param selectionFallback true, если ни один актив не прошёл исторический фильтр и взята вся вселенная
 */
public record DayResult(LocalDate referenceDay,
                        LocalDate predictionDay,
                        List<String> selectedSymbols,
                        boolean selectionFallback,
                        List<SymbolStats> symbols) {

    public DayResult {
        selectedSymbols = List.copyOf(selectedSymbols);
        symbols = List.copyOf(symbols);
    }

    public int signals() {
        return symbols.stream().mapToInt(SymbolStats::signals).sum();
    }

    public int wins() {
        return symbols.stream().mapToInt(SymbolStats::wins).sum();
    }

    public int losses() {
        return symbols.stream().mapToInt(SymbolStats::losses).sum();
    }

    public int noData() {
        return symbols.stream().mapToInt(SymbolStats::noData).sum();
    }

    public int evaluated() {
        return wins() + losses();
    }

    public boolean hasEvaluated() {
        return evaluated() > 0;
    }

    public double accuracy() {
        return evaluated() == 0 ? 0.0 : (double) wins() / evaluated();
    }

    /**
     * День выдержал цель: есть хотя бы один оценённый сигнал и точность не ниже target.
     */
    public boolean meets(double targetAccuracy) {
        return hasEvaluated() && accuracy() >= targetAccuracy;
    }
}
