package org.varavin.zones;

import org.varavin.zones.entity.Settings;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

/**
 * Декартово произведение списков значений параметров, перебираемое лениво.
 * Порядок как у вложенных циклов: первая ось меняется медленнее всех, последняя - быстрее.
 */
public final class ParameterGrid implements Iterable<Settings> {

    public record Axis<T>(String name, List<T> values, BiFunction<Settings, T, Settings> apply) {
        public Axis {
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Axis " + name + " has no values");
            }
        }

        Settings applyAt(Settings settings, int index) {
            return apply.apply(settings, values.get(index));
        }
    }

    private final Settings base;
    private final List<Axis<?>> axes;

    private ParameterGrid(Settings base, List<Axis<?>> axes) {
        this.base = base;
        this.axes = List.copyOf(axes);
    }

    public static Builder builder(Settings base) {
        return new Builder(base);
    }

    public List<Axis<?>> axes() {
        return axes;
    }

    public long size() {
        long size = 1;
        for (Axis<?> axis : axes) {
            size *= axis.values().size();
        }
        return size;
    }

    @Override
    public Iterator<Settings> iterator() {
        return new Iterator<>() {
            private final int[] position = new int[axes.size()];
            private boolean exhausted = false;

            @Override
            public boolean hasNext() {
                return !exhausted;
            }

            @Override
            public Settings next() {
                if (exhausted) {
                    throw new NoSuchElementException();
                }
                Settings candidate = base;
                for (int a = 0; a < axes.size(); a++) {
                    candidate = axes.get(a).applyAt(candidate, position[a]);
                }
                advance();
                return candidate;
            }

            private void advance() {
                for (int a = axes.size() - 1; a >= 0; a--) {
                    position[a]++;
                    if (position[a] < axes.get(a).values().size()) {
                        return;
                    }
                    position[a] = 0;
                }
                exhausted = true;
            }
        };
    }

    public static final class Builder {
        private final Settings base;
        private final List<Axis<?>> axes = new ArrayList<>();

        private Builder(Settings base) {
            this.base = base;
        }

        public <T> Builder axis(String name, List<T> values, BiFunction<Settings, T, Settings> apply) {
            axes.add(new Axis<>(name, values, apply));
            return this;
        }

        public ParameterGrid build() {
            return new ParameterGrid(base, axes);
        }
    }
}
