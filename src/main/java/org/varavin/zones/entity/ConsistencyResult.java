package org.varavin.zones.entity;

import java.util.List;

/**
 * Итог поиска устойчивой конфигурации.
 *
 * @param run      последний прогон (при неудаче - частичный, до первого провального дня)
 * @param resets   число выполненных перекалибровок
 */
public record ConsistencyResult(BacktestResult run,
                                Settings finalSettings,
                                boolean consistent,
                                int resets,
                                List<CalibrationAttempt> attempts,
                                Method method) {

    public enum Method {
        FIXED_GRID, ADAPTIVE
    }

    public ConsistencyResult {
        attempts = List.copyOf(attempts);
    }
}
