package org.varavin.zones.entity;

import java.time.LocalDate;

/**
 * Итог подбора параметров на одном дне.
 *
 * @param targetMet       найден кандидат, достигший цели (иначе settings - лучший из увиденных)
 * @param candidatesTried сколько кандидатов сетки было прогнано
 */
public record CalibrationResult(Settings settings,
                                LocalDate calibrationDay,
                                double accuracy,
                                int evaluated,
                                boolean targetMet,
                                int candidatesTried) {
}
