package org.varavin.zones;

public class Config {

    // --- Входные данные ---
    public static final String DEFAULT_DATA_FILE = "candles_data.json";
    public static final int SUMMARY_MAX_ROWS = 5;

    // --- Параметры прогона бэктеста ---
    public static final int BACKTEST_DAYS = 10;
    public static final int START_DAY_OF_MONTH = 14; // Эвристика выбора стартового дня
    public static final double TARGET_ACCURACY = 0.70;
    public static final int MAX_RESETS = 5;

    // --- Карта преобладания по времени суток ---
    public static final double PREDOMINANCE_FRACTION = 0.70;
    public static final int PREDOMINANCE_DAYS = 10;
    public static final int MIN_PRED_OCCURRENCES = 5;

    // --- Уровни поддержки/сопротивления (проценты в процентных единицах) ---
    public static final int SR_LOOKBACK_DAYS = 5;
    public static final int PIVOT_WINDOW = 3;
    public static final double CLUSTER_TOLERANCE_PCT = 0.05;
    public static final int MIN_ZONE_STRENGTH = 2;
    public static final double ZONE_TOLERANCE_PCT = 0.15;
    public static final double ZONE_MIN_PCT = 0.01;
    public static final double ZONE_MAX_PCT = 0.50;
    public static final double VOLATILITY_FACTOR = 0.0;
    public static final int VOLATILITY_PERIOD = 20;

    // --- Генерация сигналов ---
    public static final int CONFLUENCE_STEPS = 2;
    public static final int STEP_MINUTES = 5;
    public static final int FORECAST_HORIZON_HOURS = 24;

    // --- Отбор активов по истории ---
    public static final int SELECTION_LOOKBACK_HOURS = 24;
    public static final int TOP_K = 3;
    public static final double MIN_HIST_ACCURACY = 0.60;
    public static final int MIN_HIST_SIGNALS = 3;
    public static final int TREND_SMA_PERIOD = 20;
}
