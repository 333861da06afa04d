package org.varavin.zones.entity;

public enum Direction {
    CALL, PUT;

    /**
     * Свеча "в пользу" направления: close > open для CALL, close < open для PUT.
     */
    public boolean favours(Candle candle) {
        return this == CALL ? candle.isUp() : candle.isDown();
    }
}
