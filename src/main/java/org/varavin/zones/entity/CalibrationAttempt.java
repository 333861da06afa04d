package org.varavin.zones.entity;

import java.time.LocalDate;

/**
 * Запись журнала перекалибровок ("сбросов") оркестратора.
 */
public record CalibrationAttempt(int reset,
                                 LocalDate failingReferenceDay,
                                 Settings previousSettings,
                                 CalibrationResult calibration) {
}
