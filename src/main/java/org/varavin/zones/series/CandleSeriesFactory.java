package org.varavin.zones.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.MissingCapabilityException;
import org.varavin.zones.entity.Candle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Создаёт ряды нужной реализации. Табличная (ta4j) используется, если библиотека есть в classpath;
 * в режиме AUTO без неё идём на массивы с той же семантикой.
 */
public class CandleSeriesFactory {
    private static final Logger log = LoggerFactory.getLogger(CandleSeriesFactory.class);

    private static final String TABLE_MARKER_CLASS = "org.ta4j.core.BaseBarSeries";

    private final SeriesMode requestedMode;
    private final Duration barPeriod;
    private final boolean tableAvailable;
    private boolean fallbackReported = false;

    public CandleSeriesFactory(SeriesMode requestedMode, Duration barPeriod) {
        this(requestedMode, barPeriod, isClassPresent(TABLE_MARKER_CLASS));
    }

    CandleSeriesFactory(SeriesMode requestedMode, Duration barPeriod, boolean tableAvailable) {
        this.requestedMode = requestedMode;
        this.barPeriod = barPeriod;
        this.tableAvailable = tableAvailable;
        if (requestedMode == SeriesMode.TABLE && !tableAvailable) {
            throw new MissingCapabilityException("Табличное представление запрошено, но ta4j не найден в classpath");
        }
    }

    public SeriesMode effectiveMode() {
        if (requestedMode == SeriesMode.ARRAY) return SeriesMode.ARRAY;
        return tableAvailable ? SeriesMode.TABLE : SeriesMode.ARRAY;
    }

    public CandleSeries create(String symbol, List<Candle> rawCandles) {
        List<Candle> candles = normalize(symbol, rawCandles);
        if (effectiveMode() == SeriesMode.TABLE) {
            return new BarSeriesCandleSeries(symbol, candles, barPeriod);
        }
        if (requestedMode == SeriesMode.AUTO && !fallbackReported) {
            log.warn("ta4j недоступен, используется представление на массивах");
            fallbackReported = true;
        }
        return new ArrayCandleSeries(symbol, candles);
    }

    /**
     * Сортирует свечи по времени и отбрасывает дубликаты (остаётся первая).
     */
    static List<Candle> normalize(String symbol, List<Candle> rawCandles) {
        List<Candle> sorted = new ArrayList<>(rawCandles);
        sorted.sort(Comparator.comparing(Candle::time));
        List<Candle> result = new ArrayList<>(sorted.size());
        int duplicates = 0;
        for (Candle candle : sorted) {
            if (!result.isEmpty() && result.get(result.size() - 1).time().equals(candle.time())) {
                duplicates++;
                continue;
            }
            result.add(candle);
        }
        if (duplicates > 0) {
            log.warn("{}: отброшено {} свечей с повторяющимся временем", symbol, duplicates);
        }
        return result;
    }

    static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, CandleSeriesFactory.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
