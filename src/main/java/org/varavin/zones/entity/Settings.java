package org.varavin.zones.entity;

import org.varavin.zones.Config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Полный набор параметров стратегии для одного прогона.
 * Record неизменяем: каждая корректировка создаёт новый экземпляр через with-методы.
 * Проценты хранятся в процентных единицах (0.10 = 0.10%).
 */
public record Settings(
        double predominanceFraction,   // Доля большинства, нужная слоту
        int predominanceDays,          // Сколько дней истории строят карту направлений
        int srLookbackDays,            // Дней для поиска пивотов (заканчивая опорным днём)
        int pivotWindow,               // Полуокно пивота
        double clusterTolerancePct,    // Допуск кластеризации уровней, %
        double zoneTolerancePct,       // Базовая верхняя граница зоны, %
        int confluenceSteps,           // Сколько подряд слотов должны совпасть
        int forecastHorizonHours,      // Сколько часов дня прогноза просматривается
        int stepMinutes,               // Шаг слота и смещение G1
        int selectionLookbackHours,    // Окно истории для отбора активов
        int topK,                      // Сколько активов торговать в день
        double minHistAccuracy,        // Минимальная историческая точность актива
        int minHistSignals,            // Минимум оценённых сигналов в истории
        double volatilityFactor,       // Расширение зоны на средний относительный диапазон
        int minZoneStrength,           // Минимум членов кластера для "сильного" уровня
        int minPredOccurrences,        // Минимум ненулевых свечей в слоте
        double zoneMinPct,             // Нижняя граница зоны, %
        double zoneMaxPct              // Жёсткая верхняя граница зоны, %
) {

    public Settings {
        if (pivotWindow < 1) throw new IllegalArgumentException("pivotWindow must be >= 1");
        if (stepMinutes < 1) throw new IllegalArgumentException("stepMinutes must be >= 1");
        if (confluenceSteps < 1) throw new IllegalArgumentException("confluenceSteps must be >= 1");
        if (topK < 1) throw new IllegalArgumentException("topK must be >= 1");
        if (predominanceDays < 1) throw new IllegalArgumentException("predominanceDays must be >= 1");
        if (srLookbackDays < 1) throw new IllegalArgumentException("srLookbackDays must be >= 1");
        if (zoneMinPct > zoneMaxPct) throw new IllegalArgumentException("zoneMinPct must not exceed zoneMaxPct");
    }

    public static Settings defaults() {
        return new Settings(
                Config.PREDOMINANCE_FRACTION,
                Config.PREDOMINANCE_DAYS,
                Config.SR_LOOKBACK_DAYS,
                Config.PIVOT_WINDOW,
                Config.CLUSTER_TOLERANCE_PCT,
                Config.ZONE_TOLERANCE_PCT,
                Config.CONFLUENCE_STEPS,
                Config.FORECAST_HORIZON_HOURS,
                Config.STEP_MINUTES,
                Config.SELECTION_LOOKBACK_HOURS,
                Config.TOP_K,
                Config.MIN_HIST_ACCURACY,
                Config.MIN_HIST_SIGNALS,
                Config.VOLATILITY_FACTOR,
                Config.MIN_ZONE_STRENGTH,
                Config.MIN_PRED_OCCURRENCES,
                Config.ZONE_MIN_PCT,
                Config.ZONE_MAX_PCT);
    }

    /** Параметры, от которых зависят уровни; часть ключа кэша. */
    public record LevelParameters(int srLookbackDays, int pivotWindow, double clusterTolerancePct) {}

    /** Параметры, от которых зависит карта направлений; часть ключа кэша. */
    public record MapParameters(int predominanceDays, double predominanceFraction,
                                int minPredOccurrences, int stepMinutes) {}

    public LevelParameters levelParameters() {
        return new LevelParameters(srLookbackDays, pivotWindow, clusterTolerancePct);
    }

    public MapParameters mapParameters() {
        return new MapParameters(predominanceDays, predominanceFraction, minPredOccurrences, stepMinutes);
    }

    public Settings withPredominanceFraction(double v) {
        return new Settings(v, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct, zoneTolerancePct,
                confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withPredominanceDays(int v) {
        return new Settings(predominanceFraction, v, srLookbackDays, pivotWindow, clusterTolerancePct, zoneTolerancePct,
                confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withSrLookbackDays(int v) {
        return new Settings(predominanceFraction, predominanceDays, v, pivotWindow, clusterTolerancePct, zoneTolerancePct,
                confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withPivotWindow(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, v, clusterTolerancePct, zoneTolerancePct,
                confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withClusterTolerancePct(double v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, v, zoneTolerancePct,
                confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withZoneTolerancePct(double v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct, v,
                confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withConfluenceSteps(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, v, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withForecastHorizonHours(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, v, stepMinutes, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withStepMinutes(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, v, selectionLookbackHours, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withSelectionLookbackHours(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, v, topK, minHistAccuracy,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withTopK(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, v,
                minHistAccuracy, minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct,
                zoneMaxPct);
    }

    public Settings withMinHistAccuracy(double v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK, v,
                minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withMinHistSignals(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK,
                minHistAccuracy, v, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withVolatilityFactor(double v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK,
                minHistAccuracy, minHistSignals, v, minZoneStrength, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withMinZoneStrength(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK,
                minHistAccuracy, minHistSignals, volatilityFactor, v, minPredOccurrences, zoneMinPct, zoneMaxPct);
    }

    public Settings withMinPredOccurrences(int v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK,
                minHistAccuracy, minHistSignals, volatilityFactor, minZoneStrength, v, zoneMinPct, zoneMaxPct);
    }

    public Settings withZoneMinPct(double v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK,
                minHistAccuracy, minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, v, zoneMaxPct);
    }

    public Settings withZoneMaxPct(double v) {
        return new Settings(predominanceFraction, predominanceDays, srLookbackDays, pivotWindow, clusterTolerancePct,
                zoneTolerancePct, confluenceSteps, forecastHorizonHours, stepMinutes, selectionLookbackHours, topK,
                minHistAccuracy, minHistSignals, volatilityFactor, minZoneStrength, minPredOccurrences, zoneMinPct, v);
    }

    /**
     * Значения всех полей под именами опций командной строки, в порядке объявления.
     */
    public Map<String, Object> asOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("predominance-pct", predominanceFraction);
        options.put("predominance-days", predominanceDays);
        options.put("sr-days", srLookbackDays);
        options.put("pivot-window", pivotWindow);
        options.put("cluster-tolerance", clusterTolerancePct);
        options.put("zone-tolerance", zoneTolerancePct);
        options.put("confluence-steps", confluenceSteps);
        options.put("horizon-hours", forecastHorizonHours);
        options.put("step-minutes", stepMinutes);
        options.put("history-hours", selectionLookbackHours);
        options.put("top-k", topK);
        options.put("min-hist-accuracy", minHistAccuracy);
        options.put("min-hist-signals", minHistSignals);
        options.put("volatility-factor", volatilityFactor);
        options.put("min-zone-strength", minZoneStrength);
        options.put("min-occurrences", minPredOccurrences);
        options.put("zone-min", zoneMinPct);
        options.put("zone-max", zoneMaxPct);
        return options;
    }
}
