package org.varavin.zones.series;

import org.varavin.zones.entity.Candle;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Упорядоченный по времени ряд свечей одного актива.
 * Все компоненты движка работают только через этот интерфейс, поэтому реализации
 * (массив или ta4j BarSeries) взаимозаменяемы.
 */
public interface CandleSeries {

    String symbol();

    int size();

    Instant time(int index);

    double open(int index);

    double high(int index);

    double low(int index);

    double close(int index);

    /**
     * Индекс свечи с точно таким временем или -1.
     */
    int indexOf(Instant time);

    /**
     * Первый индекс, время которого не раньше {@code time} (size(), если таких нет).
     */
    int lowerBound(Instant time);

    /**
     * Срез по полуоткрытому интервалу [start, end).
     */
    CandleSeries slice(Instant start, Instant end);

    /**
     * Простое скользящее среднее close на индексе: среднее последних min(index + 1, period) закрытий.
     */
    double simpleMovingAverage(int index, int period);

    default boolean isEmpty() {
        return size() == 0;
    }

    default Candle candle(int index) {
        return new Candle(time(index), open(index), high(index), low(index), close(index));
    }

    default Optional<Candle> at(Instant time) {
        int index = indexOf(time);
        return index < 0 ? Optional.empty() : Optional.of(candle(index));
    }

    default Instant firstTime() {
        return time(0);
    }

    default Instant lastTime() {
        return time(size() - 1);
    }

    /**
     * Все календарные дни (UTC), в которые есть хотя бы одна свеча.
     */
    default SortedSet<LocalDate> days() {
        SortedSet<LocalDate> days = new TreeSet<>();
        for (int i = 0; i < size(); i++) {
            days.add(dayOf(time(i)));
        }
        return days;
    }

    default CandleSeries slice(LocalDate fromDay, LocalDate toDayExclusive) {
        return slice(startOf(fromDay), startOf(toDayExclusive));
    }

    default List<Candle> toList() {
        List<Candle> candles = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            candles.add(candle(i));
        }
        return candles;
    }

    static LocalDate dayOf(Instant time) {
        return time.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    static Instant startOf(LocalDate day) {
        return day.atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
