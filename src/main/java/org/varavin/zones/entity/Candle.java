package org.varavin.zones.entity;

import java.time.Instant;

/**
 * Одна OHLC-свеча. Время - момент открытия свечи (UTC).
 */
public record Candle(Instant time, double open, double high, double low, double close) {

    public boolean isUp() {
        return close > open;
    }

    public boolean isDown() {
        return close < open;
    }

    public boolean isFlat() {
        return close == open;
    }
}
