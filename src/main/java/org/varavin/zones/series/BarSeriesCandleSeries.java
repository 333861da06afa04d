package org.varavin.zones.series;

import org.ta4j.core.Bar;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.DoubleNum;
import org.varavin.zones.entity.Candle;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ряд поверх ta4j {@link BarSeries} с индексом времени открытия свечей.
 * Время свечи хранится как beginTime бара (endTime = time + barPeriod).
 */
public final class BarSeriesCandleSeries implements CandleSeries {

    private final BarSeries series;
    private final Duration barPeriod;
    private final Instant[] index;
    private final Map<Integer, SMAIndicator> smaByPeriod = new HashMap<>();

    public BarSeriesCandleSeries(String symbol, List<Candle> candles, Duration barPeriod) {
        this(build(symbol, candles, barPeriod), barPeriod);
    }

    private BarSeriesCandleSeries(BarSeries series, Duration barPeriod) {
        this.series = series;
        this.barPeriod = barPeriod;
        this.index = new Instant[series.getBarCount()];
        for (int i = 0; i < index.length; i++) {
            index[i] = series.getBar(i).getBeginTime().toInstant();
        }
    }

    private static BarSeries build(String symbol, List<Candle> candles, Duration barPeriod) {
        BarSeries series = new BaseBarSeriesBuilder().withNumTypeOf(DoubleNum.class).withName(symbol).build();
        for (Candle c : candles) {
            series.addBar(barPeriod, c.time().plus(barPeriod).atZone(ZoneOffset.UTC),
                    c.open(), c.high(), c.low(), c.close(), 0);
        }
        return series;
    }

    public BarSeries barSeries() {
        return series;
    }

    @Override
    public String symbol() {
        return series.getName();
    }

    @Override
    public int size() {
        return index.length;
    }

    @Override
    public Instant time(int i) {
        checkIndex(i);
        return index[i];
    }

    @Override
    public double open(int i) {
        return bar(i).getOpenPrice().doubleValue();
    }

    @Override
    public double high(int i) {
        return bar(i).getHighPrice().doubleValue();
    }

    @Override
    public double low(int i) {
        return bar(i).getLowPrice().doubleValue();
    }

    @Override
    public double close(int i) {
        return bar(i).getClosePrice().doubleValue();
    }

    @Override
    public int indexOf(Instant time) {
        int pos = Arrays.binarySearch(index, time);
        return pos >= 0 ? pos : -1;
    }

    @Override
    public int lowerBound(Instant time) {
        int pos = Arrays.binarySearch(index, time);
        return pos >= 0 ? pos : -pos - 1;
    }

    @Override
    public CandleSeries slice(Instant start, Instant end) {
        int lo = lowerBound(start);
        int hi = Math.max(lo, lowerBound(end));
        if (lo == hi) {
            // ta4j не умеет пустой подряд через getSubSeries
            return new BarSeriesCandleSeries(symbol(), List.of(), barPeriod);
        }
        return new BarSeriesCandleSeries(series.getSubSeries(lo, hi), barPeriod);
    }

    @Override
    public double simpleMovingAverage(int i, int period) {
        checkIndex(i);
        SMAIndicator sma = smaByPeriod.computeIfAbsent(period,
                p -> new SMAIndicator(new ClosePriceIndicator(series), p));
        return sma.getValue(i).doubleValue();
    }

    private Bar bar(int i) {
        checkIndex(i);
        return series.getBar(i);
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= index.length) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for series " + symbol() + " of size " + index.length);
        }
    }

    @Override
    public String toString() {
        return "BarSeriesCandleSeries{" + symbol() + ", size=" + size() + '}';
    }
}
