package org.varavin.zones.entity;

import java.util.List;

/**
 * Результаты по дням в порядке прогона. Средняя точность считается только по дням,
 * где был хотя бы один оценённый сигнал.
 */
public record BacktestResult(Settings settings, List<DayResult> days) {

    public BacktestResult {
        days = List.copyOf(days);
    }

    public double meanAccuracy() {
        return days.stream()
                .filter(DayResult::hasEvaluated)
                .mapToDouble(DayResult::accuracy)
                .average()
                .orElse(0.0);
    }

    public double pooledAccuracy() {
        int wins = days.stream().mapToInt(DayResult::wins).sum();
        int evaluated = days.stream().mapToInt(DayResult::evaluated).sum();
        return evaluated == 0 ? 0.0 : (double) wins / evaluated;
    }

    public int totalSignals() {
        return days.stream().mapToInt(DayResult::signals).sum();
    }

    public int totalEvaluated() {
        return days.stream().mapToInt(DayResult::evaluated).sum();
    }

    public long daysWithSignals() {
        return days.stream().filter(DayResult::hasEvaluated).count();
    }
}
