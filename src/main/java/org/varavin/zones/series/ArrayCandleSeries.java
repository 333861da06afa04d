package org.varavin.zones.series;

import org.varavin.zones.entity.Candle;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Ряд на простых массивах по колонкам. Срезы разделяют массивы с родителем и только сдвигают окно.
 */
public final class ArrayCandleSeries implements CandleSeries {

    private final String symbol;
    private final Instant[] times;
    private final double[] opens;
    private final double[] highs;
    private final double[] lows;
    private final double[] closes;
    private final int from;
    private final int to;

    /**
     * @param candles свечи строго по возрастанию времени
     */
    public ArrayCandleSeries(String symbol, List<Candle> candles) {
        int n = candles.size();
        this.symbol = symbol;
        this.times = new Instant[n];
        this.opens = new double[n];
        this.highs = new double[n];
        this.lows = new double[n];
        this.closes = new double[n];
        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            if (i > 0 && !c.time().isAfter(times[i - 1])) {
                throw new IllegalArgumentException("Candles must be strictly time-ascending: " + symbol + " @ " + c.time());
            }
            times[i] = c.time();
            opens[i] = c.open();
            highs[i] = c.high();
            lows[i] = c.low();
            closes[i] = c.close();
        }
        this.from = 0;
        this.to = n;
    }

    private ArrayCandleSeries(ArrayCandleSeries parent, int from, int to) {
        this.symbol = parent.symbol;
        this.times = parent.times;
        this.opens = parent.opens;
        this.highs = parent.highs;
        this.lows = parent.lows;
        this.closes = parent.closes;
        this.from = from;
        this.to = to;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int size() {
        return to - from;
    }

    @Override
    public Instant time(int index) {
        return times[checked(index)];
    }

    @Override
    public double open(int index) {
        return opens[checked(index)];
    }

    @Override
    public double high(int index) {
        return highs[checked(index)];
    }

    @Override
    public double low(int index) {
        return lows[checked(index)];
    }

    @Override
    public double close(int index) {
        return closes[checked(index)];
    }

    @Override
    public int indexOf(Instant time) {
        int pos = Arrays.binarySearch(times, from, to, time);
        return pos >= 0 ? pos - from : -1;
    }

    @Override
    public int lowerBound(Instant time) {
        int pos = Arrays.binarySearch(times, from, to, time);
        return (pos >= 0 ? pos : -pos - 1) - from;
    }

    @Override
    public CandleSeries slice(Instant start, Instant end) {
        int lo = from + lowerBound(start);
        int hi = Math.max(lo, from + lowerBound(end));
        return new ArrayCandleSeries(this, lo, hi);
    }

    @Override
    public double simpleMovingAverage(int index, int period) {
        int end = checked(index);
        int start = Math.max(from, end - period + 1);
        double sum = 0.0;
        for (int i = start; i <= end; i++) {
            sum += closes[i];
        }
        return sum / (end - start + 1);
    }

    private int checked(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for series " + symbol + " of size " + size());
        }
        return from + index;
    }

    @Override
    public String toString() {
        return "ArrayCandleSeries{" + symbol + ", size=" + size() + '}';
    }
}
