package org.varavin.zones;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.varavin.zones.entity.BacktestResult;
import org.varavin.zones.entity.Candle;
import org.varavin.zones.entity.DayResult;
import org.varavin.zones.entity.Direction;
import org.varavin.zones.entity.DirectionMap;
import org.varavin.zones.entity.Level;
import org.varavin.zones.entity.Levels;
import org.varavin.zones.entity.Pivots;
import org.varavin.zones.entity.Settings;
import org.varavin.zones.entity.SymbolStats;
import org.varavin.zones.series.BarSeriesCandleSeries;
import org.varavin.zones.series.CandleSeries;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.varavin.zones.TestCandles.*;

class BacktestRunnerTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 6);

    private static Map<String, List<Candle>> walks() {
        Map<String, List<Candle>> data = new HashMap<>();
        data.put("AAA", randomWalk(1, BASE, 7 * 288, 5, 100.0));
        data.put("BBB", randomWalk(2, BASE, 7 * 288, 5, 20.0));
        data.put("CCC", randomWalk(3, BASE, 7 * 288, 5, 1500.0));
        return data;
    }

    private static Map<String, CandleSeries> arrayUniverse(Map<String, List<Candle>> data) {
        Map<String, CandleSeries> universe = new HashMap<>();
        data.forEach((symbol, candles) -> universe.put(symbol, series(symbol, candles)));
        return universe;
    }

    private static Settings looseSettings() {
        return Settings.defaults()
                .withPredominanceDays(3)
                .withPredominanceFraction(0.6)
                .withMinPredOccurrences(2)
                .withConfluenceSteps(1)
                .withMinZoneStrength(1)
                .withZoneTolerancePct(0.3);
    }

    @Test
    void referenceDaysRunBackwardsFromStart() {
        assertEquals(List.of(START, START.minusDays(1), START.minusDays(2)), BacktestRunner.referenceDays(START, 3));
    }

    @Test
    void predictionDayIsReferencePlusOne() {
        RunContext ctx = new RunContext(looseSettings(), arrayUniverse(walks()));

        BacktestResult result = new BacktestRunner(false).run(ctx, START, 2);

        assertEquals(2, result.days().size());
        assertEquals(START, result.days().get(0).referenceDay());
        assertEquals(START.plusDays(1), result.days().get(0).predictionDay());
        assertEquals(START.minusDays(1), result.days().get(1).referenceDay());
    }

    @Test
    void runIsDeterministic() {
        Map<String, List<Candle>> data = walks();
        BacktestRunner runner = new BacktestRunner(false);

        BacktestResult first = runner.run(new RunContext(looseSettings(), arrayUniverse(data)), START, 3);
        BacktestResult second = runner.run(new RunContext(looseSettings(), arrayUniverse(data)), START, 3);

        assertEquals(first, second);
    }

    @Test
    void staleCacheEntriesDoNotLeakIntoResults() {
        Map<String, List<Candle>> data = walks();
        Settings settings = looseSettings();
        BacktestRunner runner = new BacktestRunner(false);

        RunContext clean = new RunContext(settings, arrayUniverse(data));
        RunContext dirty = new RunContext(settings, arrayUniverse(data));
        Levels bogusLevels = new Levels(List.of(new Level(1.0, 99)), List.of(new Level(1e6, 99)));
        DirectionMap bogusMap = new DirectionMap(5, Map.of(LocalTime.NOON, Direction.PUT));
        for (String symbol : data.keySet()) {
            for (LocalDate day = LocalDate.of(2024, 3, 1); day.isBefore(LocalDate.of(2024, 3, 9)); day = day.plusDays(1)) {
                dirty.levelCache().put(new CacheKey(symbol, day, settings.levelParameters()), bogusLevels);
                dirty.mapCache().put(new CacheKey(symbol, day, settings.mapParameters()), bogusMap);
            }
        }

        assertEquals(runner.run(clean, START, 3), runner.run(dirty, START, 3));
    }

    @Test
    void arrayAndTableSeriesGiveSameResult() {
        Map<String, List<Candle>> data = walks();
        Map<String, CandleSeries> table = new HashMap<>();
        data.forEach((symbol, candles) -> table.put(symbol, new BarSeriesCandleSeries(symbol, candles, FIVE_MINUTES)));
        BacktestRunner runner = new BacktestRunner(false);

        BacktestResult onArrays = runner.run(new RunContext(looseSettings(), arrayUniverse(data)), START, 2);
        BacktestResult onTable = runner.run(new RunContext(looseSettings(), table), START, 2);

        assertEquals(onArrays, onTable);
    }

    @Test
    @DisplayName("Чередующийся ряд за 30 дней: одинаковые пивоты и результаты при повторных прогонах")
    void alternatingSeriesIsReproducible() {
        List<Candle> candles = alternating(BASE, 30, 5);
        Settings settings = Settings.defaults().withPivotWindow(2);
        LocalDate start = LocalDate.of(2024, 3, 29);
        BacktestRunner runner = new BacktestRunner(false);

        Pivots first = PivotDetector.detect(series("X", candles), 2);
        Pivots second = PivotDetector.detect(series("X", candles), 2);
        BacktestResult run1 = runner.run(new RunContext(settings, Map.of("X", series("X", candles))), start, 10);
        BacktestResult run2 = runner.run(new RunContext(settings, Map.of("X", series("X", candles))), start, 10);
        BacktestResult onTable = runner.run(
                new RunContext(settings, Map.of("X", new BarSeriesCandleSeries("X", candles, FIVE_MINUTES))), start, 10);

        assertEquals(first, second);
        assertEquals(run1, run2);
        assertEquals(run1, onTable);
        assertEquals(10, run1.days().size());
    }

    @Test
    void candlesAfterPredictionDayDoNotChangeTheDay() {
        Map<String, List<Candle>> data = walks();
        LocalDate reference = LocalDate.of(2024, 3, 5);
        Map<String, List<Candle>> distorted = new HashMap<>();
        data.forEach((symbol, candles) -> distorted.put(symbol, reversedFrom(candles, reference.plusDays(2))));
        BacktestRunner runner = new BacktestRunner(false);

        DayResult original = runner.evaluateDay(new RunContext(looseSettings(), arrayUniverse(data)), reference);
        DayResult changed = runner.evaluateDay(new RunContext(looseSettings(), arrayUniverse(distorted)), reference);

        assertEquals(original, changed);
    }

    @Test
    void evaluateDayClearsCachesFirst() {
        RunContext ctx = new RunContext(Settings.defaults(), Map.of());
        ctx.levelCache().put(new CacheKey("AAA", START, "stale"), Levels.EMPTY);

        DayResult day = new BacktestRunner(false).evaluateDay(ctx, START);

        assertEquals(0, ctx.levelCache().size());
        assertTrue(day.selectedSymbols().isEmpty());
        assertFalse(day.hasEvaluated());
    }

    @Test
    void aggregatesSkipDaysWithoutEvaluatedSignals() {
        DayResult good = new DayResult(START, START.plusDays(1), List.of("A"), false,
                List.of(new SymbolStats("A", 4, 2, 1, 1, 0)));
        DayResult empty = new DayResult(START.minusDays(1), START, List.of("A"), true,
                List.of(new SymbolStats("A", 1, 0, 0, 0, 1)));
        DayResult half = new DayResult(START.minusDays(2), START.minusDays(1), List.of("A"), false,
                List.of(new SymbolStats("A", 2, 1, 0, 1, 0)));

        BacktestResult result = new BacktestResult(Settings.defaults(), List.of(good, empty, half));

        assertEquals(0.625, result.meanAccuracy(), 1e-12);
        assertEquals(4.0 / 6.0, result.pooledAccuracy(), 1e-12);
        assertEquals(7, result.totalSignals());
        assertEquals(6, result.totalEvaluated());
        assertEquals(2, result.daysWithSignals());
        assertFalse(empty.meets(0.0));
        assertTrue(good.meets(0.75));
    }
}
