package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.BacktestResult;
import org.varavin.zones.entity.CalibrationAttempt;
import org.varavin.zones.entity.CalibrationResult;
import org.varavin.zones.entity.ConsistencyResult;
import org.varavin.zones.entity.DayResult;
import org.varavin.zones.entity.Settings;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Поиск конфигурации, которая держит целевую точность на каждом дне окна.
 * Сначала можно попробовать короткий список проверенных наборов ({@link #consistencyGridSearch}),
 * затем - адаптивный цикл с перекалибровкой на дне перед провальным ({@link #run}).
 */
public class ConsistencyOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyOrchestrator.class);

    private final BacktestRunner runner;
    private final ParameterCalibrator calibrator;
    private final List<UnaryOperator<Settings>> knownGoodPresets;

    public ConsistencyOrchestrator(BacktestRunner runner, ParameterCalibrator calibrator) {
        this(runner, calibrator, defaultPresets());
    }

    public ConsistencyOrchestrator(BacktestRunner runner, ParameterCalibrator calibrator,
                                   List<UnaryOperator<Settings>> knownGoodPresets) {
        this.runner = runner;
        this.calibrator = calibrator;
        this.knownGoodPresets = List.copyOf(knownGoodPresets);
    }

    /**
     * Проверенные на практике комбинации, накладываемые поверх базовых параметров.
     */
    public static List<UnaryOperator<Settings>> defaultPresets() {
        return List.of(
                s -> s.withPredominanceFraction(0.70).withConfluenceSteps(2).withPivotWindow(3).withMinZoneStrength(2),
                s -> s.withPredominanceFraction(0.75).withConfluenceSteps(3).withPivotWindow(3).withMinZoneStrength(2),
                s -> s.withPredominanceFraction(0.65).withConfluenceSteps(2).withPivotWindow(2).withMinZoneStrength(1)
                        .withZoneTolerancePct(0.20),
                s -> s.withPredominanceFraction(0.80).withPredominanceDays(5).withConfluenceSteps(1).withTopK(2),
                s -> s.withPredominanceFraction(0.70).withPredominanceDays(15).withMinPredOccurrences(8)
                        .withVolatilityFactor(0.5));
    }

    /**
     * Прогоняет проверенные наборы по всей последовательности дней; первый, выдержавший каждый день, возвращается.
     */
    public Optional<ConsistencyResult> consistencyGridSearch(RunContext base, List<LocalDate> days, double targetAccuracy) {
        int presetIndex = 0;
        for (UnaryOperator<Settings> preset : knownGoodPresets) {
            presetIndex++;
            Settings candidate = preset.apply(base.settings());
            RunContext ctx = base.withSettings(candidate);
            List<DayResult> results = new ArrayList<>();
            boolean allMet = true;
            for (LocalDate day : days) {
                DayResult result = runner.evaluateDay(ctx, day);
                results.add(result);
                if (!result.meets(targetAccuracy)) {
                    allMet = false;
                    break;
                }
            }
            if (allMet) {
                log.info("Проверенный набор #{} выдержал все {} дней", presetIndex, days.size());
                return Optional.of(new ConsistencyResult(new BacktestResult(candidate, results), candidate,
                        true, 0, List.of(), ConsistencyResult.Method.FIXED_GRID));
            }
            log.debug("Проверенный набор #{} провалился на дне {}", presetIndex,
                    results.get(results.size() - 1).referenceDay());
        }
        log.info("Ни один из {} проверенных наборов не выдержал окно", knownGoodPresets.size());
        return Optional.empty();
    }

    public ConsistencyResult run(RunContext start, List<LocalDate> days, double targetAccuracy, int maxResets) {
        RunContext ctx = start;
        int resets = 0;
        List<CalibrationAttempt> attempts = new ArrayList<>();

        while (true) {
            List<DayResult> results = new ArrayList<>();
            DayResult failing = null;
            for (LocalDate day : days) {
                DayResult result = runner.evaluateDay(ctx, day);
                results.add(result);
                if (!result.meets(targetAccuracy)) {
                    failing = result;
                    break;
                }
            }
            BacktestResult pass = new BacktestResult(ctx.settings(), results);

            if (failing == null) {
                log.info("Конфигурация устойчива на всех {} днях после {} перекалибровок", days.size(), resets);
                return new ConsistencyResult(pass, ctx.settings(), true, resets, attempts, ConsistencyResult.Method.ADAPTIVE);
            }
            if (resets >= maxResets) {
                log.warn("Исчерпан лимит перекалибровок ({}), последний провальный день {}",
                        maxResets, failing.referenceDay());
                return new ConsistencyResult(pass, ctx.settings(), false, resets, attempts, ConsistencyResult.Method.ADAPTIVE);
            }

            LocalDate calibrationDay = failing.referenceDay().minusDays(1);
            log.info("Провал на дне {} (оценено {}, точность {}), перекалибровка на {}",
                    failing.referenceDay(), failing.evaluated(),
                    String.format("%.2f%%", failing.accuracy() * 100), calibrationDay);
            CalibrationResult calibration = calibrator.calibrate(ctx, calibrationDay, targetAccuracy);
            resets++;
            attempts.add(new CalibrationAttempt(resets, failing.referenceDay(), ctx.settings(), calibration));
            ctx = ctx.withSettings(calibration.settings());
        }
    }
}
