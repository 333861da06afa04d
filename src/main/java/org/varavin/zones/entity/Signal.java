package org.varavin.zones.entity;

import java.time.Instant;

public record Signal(String symbol, Instant time, Direction direction, ZoneType zone) {
}
