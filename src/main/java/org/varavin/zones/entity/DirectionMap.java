package org.varavin.zones.entity;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Преобладающее направление по слотам времени суток (UTC, шаг stepMinutes).
 * Отсутствие слота означает "надёжного смещения нет".
 */
public final class DirectionMap {

    private final int stepMinutes;
    private final Map<LocalTime, Direction> slots;

    public DirectionMap(int stepMinutes, Map<LocalTime, Direction> slots) {
        if (stepMinutes <= 0) {
            throw new IllegalArgumentException("stepMinutes must be positive: " + stepMinutes);
        }
        this.stepMinutes = stepMinutes;
        this.slots = Collections.unmodifiableMap(new TreeMap<>(slots));
    }

    public static DirectionMap empty(int stepMinutes) {
        return new DirectionMap(stepMinutes, Map.of());
    }

    public static LocalTime slotOf(Instant time, int stepMinutes) {
        LocalTime local = time.atOffset(ZoneOffset.UTC).toLocalTime();
        int minuteOfDay = local.getHour() * 60 + local.getMinute();
        int floored = (minuteOfDay / stepMinutes) * stepMinutes;
        return LocalTime.of(floored / 60, floored % 60);
    }

    public Optional<Direction> directionAt(Instant time) {
        return Optional.ofNullable(slots.get(slotOf(time, stepMinutes)));
    }

    public Optional<Direction> get(LocalTime slot) {
        return Optional.ofNullable(slots.get(slot));
    }

    public Map<LocalTime, Direction> asMap() {
        return slots;
    }

    public int stepMinutes() {
        return stepMinutes;
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectionMap other)) return false;
        return stepMinutes == other.stepMinutes && slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        return 31 * stepMinutes + slots.hashCode();
    }

    @Override
    public String toString() {
        return "DirectionMap{step=" + stepMinutes + ", slots=" + slots + '}';
    }
}
