package org.varavin.zones;

import org.varavin.zones.entity.Level;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Жадная кластеризация цен пивотов в уровни.
 * Цены сортируются; следующая цена входит в текущий кластер, пока её относительное
 * расстояние до текущего среднего кластера не больше допуска (в процентах).
 */
public final class LevelClusterer {

    private LevelClusterer() {
    }

    public static List<Level> cluster(Collection<Double> prices, double tolerancePct) {
        List<Double> sorted = new ArrayList<>(prices);
        sorted.sort(Double::compare);

        List<Level> levels = new ArrayList<>();
        double sum = 0.0;
        int count = 0;
        for (double price : sorted) {
            if (count > 0) {
                double mean = sum / count;
                if (relativeDistancePct(price, mean) > tolerancePct) {
                    levels.add(new Level(mean, count));
                    sum = 0.0;
                    count = 0;
                }
            }
            sum += price;
            count++;
        }
        if (count > 0) {
            levels.add(new Level(sum / count, count));
        }
        return levels;
    }

    static double relativeDistancePct(double price, double reference) {
        if (reference == 0.0) {
            return price == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs(price - reference) / Math.abs(reference) * 100.0;
    }
}
