package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.Direction;
import org.varavin.zones.entity.DirectionMap;
import org.varavin.zones.entity.Level;
import org.varavin.zones.entity.Levels;
import org.varavin.zones.entity.Pivots;
import org.varavin.zones.entity.Settings;
import org.varavin.zones.entity.Signal;
import org.varavin.zones.entity.ZoneType;
import org.varavin.zones.series.CandleSeries;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Сигналы на день: зона (поддержка/сопротивление) плюс совпадение карты направлений
 * в confluenceSteps подряд слотах. CALL только у поддержки при смещении вверх,
 * PUT только у сопротивления при смещении вниз.
 */
public final class SignalGenerator {
    private static final Logger log = LoggerFactory.getLogger(SignalGenerator.class);

    private SignalGenerator() {
    }

    /**
     * Сигналы на весь горизонт прогноза дня, без трендового фильтра.
     */
    public static List<Signal> generate(RunContext ctx, CandleSeries series, LocalDate day) {
        Instant dayStart = CandleSeries.startOf(day);
        Instant horizonEnd = dayStart.plus(Duration.ofHours(ctx.settings().forecastHorizonHours()));
        Instant dayEnd = CandleSeries.startOf(day.plusDays(1));
        Instant end = horizonEnd.isBefore(dayEnd) ? horizonEnd : dayEnd;
        return generate(ctx, series, day, dayStart, end, false);
    }

    /**
     * Сигналы для свечей дня {@code day} со временем в [from, to).
     *
     * @param trendFilter дополнительно требовать, чтобы предыдущая свеча была против направления,
     *                    а наклон SMA не противоречил ему (используется только при отборе активов)
     */
    public static List<Signal> generate(RunContext ctx, CandleSeries series, LocalDate day,
                                        Instant from, Instant to, boolean trendFilter) {
        Settings s = ctx.settings();
        List<Signal> signals = new ArrayList<>();
        Levels levels = levelsFor(ctx, series, day);
        if (levels.isEmpty()) {
            return signals;
        }
        DirectionMap map = directionMapFor(ctx, series, day);
        if (map.isEmpty()) {
            return signals;
        }

        Instant dayStart = CandleSeries.startOf(day);
        Instant dayEnd = CandleSeries.startOf(day.plusDays(1));
        Instant start = from.isAfter(dayStart) ? from : dayStart;
        Instant end = to.isBefore(dayEnd) ? to : dayEnd;

        for (int i = Math.max(1, series.lowerBound(start)); i < series.size(); i++) {
            Instant t = series.time(i);
            if (!t.isBefore(end)) {
                break;
            }
            double previousClose = series.close(i - 1);
            double zoneMax = effectiveZoneMax(s, series, i);
            ZoneType zone = ZoneTest.test(previousClose, levels, s.minZoneStrength(), s.zoneMinPct(), zoneMax);
            if (zone == ZoneType.NONE) {
                continue;
            }
            Optional<Direction> bias = confluence(map, t, s.confluenceSteps(), s.stepMinutes());
            if (bias.isEmpty()) {
                continue;
            }
            Direction direction = bias.get();
            boolean agrees = (direction == Direction.CALL && zone == ZoneType.SUPPORT)
                    || (direction == Direction.PUT && zone == ZoneType.RESISTANCE);
            if (!agrees) {
                continue;
            }
            if (trendFilter && !trendAgrees(series, i - 1, direction)) {
                continue;
            }
            signals.add(new Signal(series.symbol(), t, direction, zone));
        }
        log.debug("{} {}: {} сигналов", series.symbol(), day, signals.size());
        return signals;
    }

    /**
     * Направление, если карта содержит одно и то же направление для слотов t, t+s, ..., t+(n-1)s.
     */
    static Optional<Direction> confluence(DirectionMap map, Instant t, int steps, int stepMinutes) {
        Direction agreed = null;
        for (int k = 0; k < steps; k++) {
            Optional<Direction> d = map.directionAt(t.plus(Duration.ofMinutes((long) k * stepMinutes)));
            if (d.isEmpty()) {
                return Optional.empty();
            }
            if (agreed == null) {
                agreed = d.get();
            } else if (agreed != d.get()) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(agreed);
    }

    /**
     * CALL: предыдущая свеча падающая и наклон SMA неотрицательный; PUT - зеркально.
     */
    static boolean trendAgrees(CandleSeries series, int previous, Direction direction) {
        if (previous < 1) {
            return false;
        }
        double slope = series.simpleMovingAverage(previous, Config.TREND_SMA_PERIOD)
                - series.simpleMovingAverage(previous - 1, Config.TREND_SMA_PERIOD);
        double open = series.open(previous);
        double close = series.close(previous);
        if (direction == Direction.CALL) {
            return close < open && slope >= 0.0;
        }
        return close > open && slope <= 0.0;
    }

    /**
     * Верхняя граница полосы: базовый допуск плюс фактор волатильности, но не больше zoneMaxPct.
     */
    static double effectiveZoneMax(Settings s, CandleSeries series, int index) {
        double widened = s.zoneTolerancePct();
        if (s.volatilityFactor() > 0.0) {
            widened += s.volatilityFactor() * meanRelativeRangePct(series, index, Config.VOLATILITY_PERIOD);
        }
        return Math.min(s.zoneMaxPct(), widened);
    }

    /**
     * Средний (high - low) / close в процентах по свечам, предшествующим index.
     */
    static double meanRelativeRangePct(CandleSeries series, int index, int period) {
        int from = Math.max(0, index - period);
        double sum = 0.0;
        int count = 0;
        for (int j = from; j < index; j++) {
            double close = series.close(j);
            if (close != 0.0) {
                sum += (series.high(j) - series.low(j)) / close * 100.0;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Уровни для дня {@code day}: пивоты последних srLookbackDays дней с данными до этого дня.
     */
    public static Levels levelsFor(RunContext ctx, CandleSeries series, LocalDate day) {
        Settings.LevelParameters p = ctx.settings().levelParameters();
        CacheKey key = new CacheKey(series.symbol(), day, p);
        return ctx.levelCache().getOrCompute(key, () -> computeLevels(series, day, p));
    }

    static Levels computeLevels(CandleSeries series, LocalDate day, Settings.LevelParameters p) {
        List<LocalDate> window = DirectionMapBuilder.daysBefore(series, day, p.srLookbackDays());
        if (window.isEmpty()) {
            return Levels.EMPTY;
        }
        CandleSeries history = series.slice(window.get(0), day);
        Pivots pivots = PivotDetector.detect(history, p.pivotWindow());
        List<Level> supports = LevelClusterer.cluster(pivots.supports(), p.clusterTolerancePct());
        List<Level> resistances = LevelClusterer.cluster(pivots.resistances(), p.clusterTolerancePct());
        return new Levels(supports, resistances);
    }

    /**
     * Карта направлений для дня {@code day}: только дни строго до него.
     */
    public static DirectionMap directionMapFor(RunContext ctx, CandleSeries series, LocalDate day) {
        Settings.MapParameters p = ctx.settings().mapParameters();
        CacheKey key = new CacheKey(series.symbol(), day, p);
        return ctx.mapCache().getOrCompute(key, () -> {
            List<LocalDate> days = DirectionMapBuilder.daysBefore(series, day, p.predominanceDays());
            if (days.isEmpty()) {
                return DirectionMap.empty(p.stepMinutes());
            }
            CandleSeries history = series.slice(days.get(0), day);
            return DirectionMapBuilder.build(history, days, p.stepMinutes(),
                    p.minPredOccurrences(), p.predominanceFraction());
        });
    }
}
