package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.CalibrationResult;
import org.varavin.zones.entity.DayResult;
import org.varavin.zones.entity.Settings;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Подбор параметров по сетке на одном опорном дне.
 * Возвращает первого кандидата, достигшего цели (порядок перебора важен),
 * иначе лучший по (точность, число оценённых сигналов).
 */
public class ParameterCalibrator {
    private static final Logger log = LoggerFactory.getLogger(ParameterCalibrator.class);

    private final BacktestRunner runner;
    private final Function<Settings, ParameterGrid> gridFactory;

    public ParameterCalibrator(BacktestRunner runner) {
        this(runner, ParameterCalibrator::defaultGrid);
    }

    public ParameterCalibrator(BacktestRunner runner, Function<Settings, ParameterGrid> gridFactory) {
        this.runner = runner;
        this.gridFactory = gridFactory;
    }

    public static ParameterGrid defaultGrid(Settings base) {
        return ParameterGrid.builder(base)
                .axis("predominance-pct", List.of(0.60, 0.70, 0.80), Settings::withPredominanceFraction)
                .axis("predominance-days", List.of(5, 10), Settings::withPredominanceDays)
                .axis("pivot-window", List.of(2, 3), Settings::withPivotWindow)
                .axis("cluster-tolerance", List.of(0.03, 0.06), Settings::withClusterTolerancePct)
                .axis("zone-tolerance", List.of(0.10, 0.20), Settings::withZoneTolerancePct)
                .axis("confluence-steps", List.of(1, 2), Settings::withConfluenceSteps)
                .axis("top-k", List.of(2, 3), Settings::withTopK)
                .axis("min-hist-accuracy", List.of(0.55, 0.65), Settings::withMinHistAccuracy)
                .axis("min-hist-signals", List.of(2, 4), Settings::withMinHistSignals)
                .axis("volatility-factor", List.of(0.0, 0.5), Settings::withVolatilityFactor)
                .axis("min-zone-strength", List.of(1, 2), Settings::withMinZoneStrength)
                .axis("min-occurrences", List.of(3, 5), Settings::withMinPredOccurrences)
                .build();
    }

    public CalibrationResult calibrate(RunContext base, LocalDate calibrationDay, double targetAccuracy) {
        ParameterGrid grid = gridFactory.apply(base.settings());
        log.info("--- Калибровка на дне {}: цель {}, кандидатов до {} ---",
                calibrationDay, String.format("%.2f%%", targetAccuracy * 100), grid.size());

        Settings bestSettings = base.settings();
        double bestAccuracy = -1.0;
        int bestEvaluated = -1;
        int tried = 0;

        for (Settings candidate : grid) {
            tried++;
            // у каждого кандидата свои кэши
            DayResult day = runner.evaluateDay(base.withSettings(candidate), calibrationDay);

            if (day.meets(targetAccuracy)) {
                log.info("Цель достигнута кандидатом #{}: точность {}, оценено {}",
                        tried, String.format("%.2f%%", day.accuracy() * 100), day.evaluated());
                return new CalibrationResult(candidate, calibrationDay, day.accuracy(), day.evaluated(), true, tried);
            }
            if (isBetter(day.accuracy(), day.evaluated(), bestAccuracy, bestEvaluated)) {
                bestAccuracy = day.accuracy();
                bestEvaluated = day.evaluated();
                bestSettings = candidate;
                log.debug("НОВЫЙ ЛИДЕР #{}: точность {} | оценено {}",
                        tried, String.format("%.2f%%", bestAccuracy * 100), bestEvaluated);
            }
        }

        log.warn("Цель не достигнута за {} кандидатов, лучший: точность {}, оценено {}",
                tried, String.format("%.2f%%", Math.max(bestAccuracy, 0.0) * 100), Math.max(bestEvaluated, 0));
        return new CalibrationResult(bestSettings, calibrationDay, Math.max(bestAccuracy, 0.0),
                Math.max(bestEvaluated, 0), false, tried);
    }

    static boolean isBetter(double accuracy, int evaluated, double bestAccuracy, int bestEvaluated) {
        if (accuracy != bestAccuracy) {
            return accuracy > bestAccuracy;
        }
        return evaluated > bestEvaluated;
    }
}
