package org.varavin.zones;

import java.time.LocalDate;

/**
 * Ключ кэша: актив, день, для которого посчитано значение, и значимое подмножество параметров.
 * parameters - record, поэтому равенство ключей точное, без хешей.
 */
public record CacheKey(String symbol, LocalDate day, Object parameters) {
}
