package org.varavin.zones.entity;

public enum ZoneType {
    SUPPORT, RESISTANCE, NONE
}
