package org.varavin.zones.entity;

/**
 * Уровень поддержки/сопротивления: среднее кластера пивотов и число его членов.
 */
public record Level(double price, int strength) {
}
