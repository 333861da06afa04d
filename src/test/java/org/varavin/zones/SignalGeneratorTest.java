package org.varavin.zones;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.varavin.zones.entity.Candle;
import org.varavin.zones.entity.Direction;
import org.varavin.zones.entity.DirectionMap;
import org.varavin.zones.entity.Level;
import org.varavin.zones.entity.Levels;
import org.varavin.zones.entity.Settings;
import org.varavin.zones.entity.Signal;
import org.varavin.zones.entity.ZoneType;
import org.varavin.zones.series.CandleSeries;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.varavin.zones.TestCandles.*;

class SignalGeneratorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 2);
    private static final Instant DAY_START = CandleSeries.startOf(DAY);

    private Settings settings;
    private CandleSeries series;
    private RunContext ctx;

    @BeforeEach
    void setUp() {
        settings = Settings.defaults();
        series = series("A", List.of(
                flat(DAY_START, 100),
                flat(DAY_START.plus(FIVE_MINUTES), 100),
                flat(DAY_START.plus(FIVE_MINUTES.multipliedBy(2)), 100)));
        ctx = new RunContext(settings, Map.of("A", series));
    }

    private void prime(Levels levels, Direction slotDirection) {
        ctx.levelCache().put(new CacheKey("A", DAY, settings.levelParameters()), levels);
        ctx.mapCache().put(new CacheKey("A", DAY, settings.mapParameters()), new DirectionMap(5, Map.of(
                LocalTime.of(0, 5), slotDirection,
                LocalTime.of(0, 10), slotDirection)));
    }

    @Test
    void callAtSupportWithUpwardBias() {
        prime(new Levels(List.of(new Level(99.9, 2)), List.of()), Direction.CALL);

        List<Signal> signals = SignalGenerator.generate(ctx, series, DAY);

        assertEquals(List.of(new Signal("A", DAY_START.plus(FIVE_MINUTES), Direction.CALL, ZoneType.SUPPORT)), signals);
    }

    @Test
    void putAtResistanceWithDownwardBias() {
        prime(new Levels(List.of(), List.of(new Level(100.1, 3))), Direction.PUT);

        List<Signal> signals = SignalGenerator.generate(ctx, series, DAY);

        assertEquals(1, signals.size());
        assertEquals(Direction.PUT, signals.get(0).direction());
        assertEquals(ZoneType.RESISTANCE, signals.get(0).zone());
    }

    @Test
    void biasAgainstZoneGivesNoSignal() {
        prime(new Levels(List.of(new Level(99.9, 2)), List.of()), Direction.PUT);

        assertTrue(SignalGenerator.generate(ctx, series, DAY).isEmpty());
    }

    @Test
    void noZoneGivesNoSignal() {
        prime(new Levels(List.of(new Level(95.0, 2)), List.of()), Direction.CALL);

        assertTrue(SignalGenerator.generate(ctx, series, DAY).isEmpty());
    }

    @Test
    void firstCandleOfSeriesIsNeverSignalled() {
        ctx.levelCache().put(new CacheKey("A", DAY, settings.levelParameters()),
                new Levels(List.of(new Level(99.9, 2)), List.of()));
        ctx.mapCache().put(new CacheKey("A", DAY, settings.mapParameters()), new DirectionMap(5, Map.of(
                LocalTime.of(0, 0), Direction.CALL,
                LocalTime.of(0, 5), Direction.CALL)));

        List<Signal> signals = SignalGenerator.generate(ctx, series, DAY);

        assertTrue(signals.stream().noneMatch(s -> s.time().equals(DAY_START)));
    }

    @Test
    void defaultBandEndsAtZoneToleranceNotZoneMax() {
        // 0.3% - внутри [zoneMin, zoneMax], но дальше zoneTolerance
        prime(new Levels(List.of(new Level(99.7, 3)), List.of()), Direction.CALL);

        assertTrue(SignalGenerator.generate(ctx, series, DAY).isEmpty());

        Settings wider = settings.withZoneTolerancePct(0.4);
        RunContext widerCtx = new RunContext(wider, Map.of("A", series));
        widerCtx.levelCache().put(new CacheKey("A", DAY, wider.levelParameters()),
                new Levels(List.of(new Level(99.7, 3)), List.of()));
        widerCtx.mapCache().put(new CacheKey("A", DAY, wider.mapParameters()), new DirectionMap(5, Map.of(
                LocalTime.of(0, 5), Direction.CALL,
                LocalTime.of(0, 10), Direction.CALL)));

        assertEquals(1, SignalGenerator.generate(widerCtx, series, DAY).size());
    }

    @Test
    void confluenceNeedsAllStepsToAgree() {
        DirectionMap map = new DirectionMap(5, Map.of(
                LocalTime.of(0, 5), Direction.CALL,
                LocalTime.of(0, 10), Direction.CALL,
                LocalTime.of(0, 15), Direction.PUT));
        Instant t = DAY_START.plus(FIVE_MINUTES);

        assertEquals(Optional.of(Direction.CALL), SignalGenerator.confluence(map, t, 2, 5));
        assertEquals(Optional.empty(), SignalGenerator.confluence(map, t, 3, 5));
        assertEquals(Optional.empty(), SignalGenerator.confluence(map, DAY_START, 1, 5));
    }

    @Test
    void levelsIgnoreCandlesOfTheDayItself() {
        List<Candle> candles = new ArrayList<>(randomWalk(7, BASE, 2 * 288, 5, 100.0));
        int spike = 288 + 100;
        Candle c = candles.get(spike);
        candles.set(spike, candle(c.time(), c.open(), 200.0, c.low(), c.close()));
        CandleSeries full = series("A", candles);
        CandleSeries firstDayOnly = series("A", candles.subList(0, 288));
        RunContext fullCtx = new RunContext(settings, Map.of("A", full));

        Levels levels = SignalGenerator.levelsFor(fullCtx, full, DAY);

        assertFalse(levels.isEmpty());
        assertTrue(levels.resistances().stream().allMatch(l -> l.price() < 150.0));
        assertEquals(SignalGenerator.computeLevels(firstDayOnly, DAY, settings.levelParameters()), levels);
    }

    @Test
    void levelsAreCachedPerDay() {
        CandleSeries walk = series("A", randomWalk(3, BASE, 3 * 288, 5, 100.0));
        RunContext walkCtx = new RunContext(settings, Map.of("A", walk));

        Levels first = SignalGenerator.levelsFor(walkCtx, walk, DAY);
        Levels second = SignalGenerator.levelsFor(walkCtx, walk, DAY);

        assertSame(first, second);
        assertEquals(1, walkCtx.levelCache().hits());
        walkCtx.invalidateCaches();
        assertEquals(0, walkCtx.levelCache().size());
    }

    @Test
    void trendFilterWantsPullbackAgainstDirection() {
        List<Candle> candles = new ArrayList<>();
        for (int j = 0; j < 5; j++) {
            candles.add(candle(at(j), 100 + j, 101 + j, 99 + j, 100.5 + j));
        }
        candles.add(candle(at(5), 106, 107, 105, 105.8));
        CandleSeries rising = series("A", candles);

        assertTrue(SignalGenerator.trendAgrees(rising, 5, Direction.CALL));
        assertFalse(SignalGenerator.trendAgrees(rising, 5, Direction.PUT));
        assertFalse(SignalGenerator.trendAgrees(rising, 0, Direction.CALL));
    }

    @Test
    void volatilityWidensZoneUpToHardLimit() {
        List<Candle> candles = new ArrayList<>();
        for (int j = 0; j < 30; j++) {
            candles.add(flat(at(j), 100));
        }
        CandleSeries ranged = series("A", candles);

        assertEquals(settings.zoneTolerancePct(), SignalGenerator.effectiveZoneMax(settings, ranged, 25));
        assertEquals(2.0, SignalGenerator.meanRelativeRangePct(ranged, 25, 20), 1e-9);
        assertEquals(settings.zoneMaxPct(),
                SignalGenerator.effectiveZoneMax(settings.withVolatilityFactor(1.0), ranged, 25));
        Settings wide = settings.withVolatilityFactor(1.0).withZoneMaxPct(5.0);
        assertEquals(wide.zoneTolerancePct() + 2.0, SignalGenerator.effectiveZoneMax(wide, ranged, 25), 1e-9);
    }
}
