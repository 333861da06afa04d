package org.varavin.zones;

import org.varavin.zones.entity.Pivots;
import org.varavin.zones.series.CandleSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Локальные экстремумы по симметричному окну.
 * Свеча i - сопротивление, если её high строго выше всех high в w свечах слева и справа;
 * поддержка - если low строго ниже всех low. Свечи ближе w к краям не проверяются.
 */
public final class PivotDetector {

    private PivotDetector() {
    }

    public static Pivots detect(CandleSeries series, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Pivot window must be >= 1: " + window);
        }
        List<Double> resistances = new ArrayList<>();
        List<Double> supports = new ArrayList<>();
        int n = series.size();
        for (int i = window; i < n - window; i++) {
            if (isPivotHigh(series, i, window)) {
                resistances.add(series.high(i));
            }
            if (isPivotLow(series, i, window)) {
                supports.add(series.low(i));
            }
        }
        return new Pivots(resistances, supports);
    }

    private static boolean isPivotHigh(CandleSeries series, int i, int window) {
        double high = series.high(i);
        for (int j = i - window; j <= i + window; j++) {
            if (j != i && series.high(j) >= high) {
                return false;
            }
        }
        return true;
    }

    private static boolean isPivotLow(CandleSeries series, int i, int window) {
        double low = series.low(i);
        for (int j = i - window; j <= i + window; j++) {
            if (j != i && series.low(j) <= low) {
                return false;
            }
        }
        return true;
    }
}
