package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.BacktestResult;
import org.varavin.zones.entity.DayResult;
import org.varavin.zones.entity.Outcome;
import org.varavin.zones.entity.Signal;
import org.varavin.zones.entity.SymbolStats;
import org.varavin.zones.series.CandleSeries;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Прогон по дням: для каждого опорного дня (от стартового назад) отбираем активы по истории,
 * строим сигналы на следующий день и оцениваем их.
 */
public class BacktestRunner {
    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final boolean needPrintLog;

    public BacktestRunner(boolean needPrintLog) {
        this.needPrintLog = needPrintLog;
    }

    /**
     * Опорные дни: startDay, startDay - 1, ..., startDay - (numDays - 1).
     */
    public static List<LocalDate> referenceDays(LocalDate startDay, int numDays) {
        List<LocalDate> days = new ArrayList<>(numDays);
        for (int offset = 0; offset < numDays; offset++) {
            days.add(startDay.minusDays(offset));
        }
        return days;
    }

    public BacktestResult run(RunContext ctx, LocalDate startDay, int numDays) {
        return run(ctx, referenceDays(startDay, numDays));
    }

    public BacktestResult run(RunContext ctx, List<LocalDate> referenceDays) {
        List<DayResult> results = new ArrayList<>(referenceDays.size());
        for (LocalDate referenceDay : referenceDays) {
            results.add(evaluateDay(ctx, referenceDay));
        }
        BacktestResult result = new BacktestResult(ctx.settings(), results);
        if (needPrintLog) {
            log.info("Бэктест завершён: дней {}, с сигналами {}, средняя точность {}",
                    results.size(), result.daysWithSignals(), String.format("%.2f%%", result.meanAccuracy() * 100));
        }
        return result;
    }

    /**
     * Один опорный день. Кэши сбрасываются до любых вычислений этого дня.
     */
    public DayResult evaluateDay(RunContext ctx, LocalDate referenceDay) {
        ctx.invalidateCaches();
        LocalDate predictionDay = referenceDay.plusDays(1);
        SymbolSelector.Selection selection = SymbolSelector.select(ctx, predictionDay);

        Instant visibleEnd = CandleSeries.startOf(predictionDay.plusDays(1));
        Duration step = Duration.ofMinutes(ctx.settings().stepMinutes());
        List<SymbolStats> perSymbol = new ArrayList<>();
        for (String symbol : selection.symbols()) {
            CandleSeries visible = ctx.series(symbol).slice(Instant.MIN, visibleEnd);
            List<Outcome> outcomes = new ArrayList<>();
            for (Signal signal : SignalGenerator.generate(ctx, visible, predictionDay)) {
                outcomes.add(OutcomeEvaluator.evaluate(visible, signal, step));
            }
            perSymbol.add(SymbolStats.of(symbol, outcomes));
        }

        DayResult day = new DayResult(referenceDay, predictionDay, selection.symbols(), selection.fallback(), perSymbol);
        if (needPrintLog) {
            log.info("День {} -> {}: активы {}{}, сигналов {}, оценено {}, точность {}",
                    referenceDay, predictionDay, day.selectedSymbols(), day.selectionFallback() ? " (вся вселенная)" : "",
                    day.signals(), day.evaluated(), String.format("%.2f%%", day.accuracy() * 100));
        }
        return day;
    }
}
