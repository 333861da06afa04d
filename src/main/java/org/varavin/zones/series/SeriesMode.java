package org.varavin.zones.series;

public enum SeriesMode {
    AUTO, ARRAY, TABLE
}
