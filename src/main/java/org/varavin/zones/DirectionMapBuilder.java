package org.varavin.zones;

import org.varavin.zones.entity.Direction;
import org.varavin.zones.entity.DirectionMap;
import org.varavin.zones.series.CandleSeries;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Строит карту преобладающего направления по слотам времени суток.
 * Свечи с open == close не учитываются ни в одну сторону.
 * При равенстве числа растущих и падающих свечей выбирается CALL (если такая доля проходит порог).
 */
public final class DirectionMapBuilder {

    private DirectionMapBuilder() {
    }

    public static DirectionMap build(CandleSeries series, Collection<LocalDate> days, int stepMinutes,
                                     int minOccurrences, double predominanceFraction) {
        Set<LocalDate> daySet = Set.copyOf(days);
        Map<LocalTime, int[]> counts = new HashMap<>();
        for (int i = 0; i < series.size(); i++) {
            double open = series.open(i);
            double close = series.close(i);
            if (open == close || !daySet.contains(CandleSeries.dayOf(series.time(i)))) {
                continue;
            }
            int[] upDown = counts.computeIfAbsent(DirectionMap.slotOf(series.time(i), stepMinutes), k -> new int[2]);
            if (close > open) {
                upDown[0]++;
            } else {
                upDown[1]++;
            }
        }

        Map<LocalTime, Direction> slots = new HashMap<>();
        for (Map.Entry<LocalTime, int[]> e : counts.entrySet()) {
            int up = e.getValue()[0];
            int down = e.getValue()[1];
            int total = up + down;
            if (total < minOccurrences) {
                continue;
            }
            double majority = (double) Math.max(up, down) / total;
            if (majority >= predominanceFraction) {
                slots.put(e.getKey(), up >= down ? Direction.CALL : Direction.PUT);
            }
        }
        return new DirectionMap(stepMinutes, slots);
    }

    /**
     * Последние {@code count} дней с данными строго до {@code targetDay}.
     */
    public static List<LocalDate> daysBefore(CandleSeries series, LocalDate targetDay, int count) {
        SortedSet<LocalDate> before = series.days().headSet(targetDay);
        List<LocalDate> all = new ArrayList<>(before);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }
}
