package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.DirectionMap;
import org.varavin.zones.entity.Levels;
import org.varavin.zones.entity.Settings;
import org.varavin.zones.series.CandleSeries;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Контекст одного прогона: параметры, вселенная активов и кэши уровней и карт.
 * Кэши принадлежат контексту; компоненты их только читают и пополняют,
 * а очищает их цикл по дням через {@link #invalidateCaches()}.
 */
public class RunContext {
    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final Settings settings;
    private final Map<String, CandleSeries> universe;
    private final SeriesCache<Levels> levelCache = new SeriesCache<>("levels");
    private final SeriesCache<DirectionMap> mapCache = new SeriesCache<>("directionMaps");

    public RunContext(Settings settings, Map<String, CandleSeries> universe) {
        this.settings = settings;
        this.universe = Collections.unmodifiableMap(new TreeMap<>(universe));
    }

    /**
     * Новый контекст с другими параметрами и собственными (пустыми) кэшами.
     */
    public RunContext withSettings(Settings newSettings) {
        return new RunContext(newSettings, universe);
    }

    public Settings settings() {
        return settings;
    }

    public Map<String, CandleSeries> universe() {
        return universe;
    }

    public List<String> symbols() {
        return List.copyOf(universe.keySet());
    }

    public CandleSeries series(String symbol) {
        CandleSeries series = universe.get(symbol);
        if (series == null) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return series;
    }

    public SeriesCache<Levels> levelCache() {
        return levelCache;
    }

    public SeriesCache<DirectionMap> mapCache() {
        return mapCache;
    }

    public void invalidateCaches() {
        log.debug("Сброс кэшей: {}, {}", levelCache, mapCache);
        levelCache.invalidate();
        mapCache.invalidate();
    }
}
