package org.varavin.zones;

import org.varavin.zones.entity.Settings;
import org.varavin.zones.series.SeriesMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Разбор аргументов командной строки. Любое поле {@link Settings} переопределяется
 * опцией с тем же именем, что и в {@link Settings#asOptions()}.
 * Поддерживаются формы "--name value" и "--name=value".
 */
public record CommandLineOptions(Path path,
                                 Mode mode,
                                 int days,
                                 Optional<LocalDate> startDay,
                                 double targetAccuracy,
                                 int maxResets,
                                 SeriesMode seriesMode,
                                 int maxRows,
                                 Settings settings) {

    public enum Mode {
        SUMMARY, BACKTEST, AUTO_TUNE, HELP
    }

    private static final Map<String, BiFunction<Settings, String, Settings>> SETTINGS_OPTIONS = new LinkedHashMap<>();

    static {
        SETTINGS_OPTIONS.put("predominance-pct", (s, v) -> s.withPredominanceFraction(parseDouble(v)));
        SETTINGS_OPTIONS.put("predominance-days", (s, v) -> s.withPredominanceDays(parseInt(v)));
        SETTINGS_OPTIONS.put("sr-days", (s, v) -> s.withSrLookbackDays(parseInt(v)));
        SETTINGS_OPTIONS.put("pivot-window", (s, v) -> s.withPivotWindow(parseInt(v)));
        SETTINGS_OPTIONS.put("cluster-tolerance", (s, v) -> s.withClusterTolerancePct(parseDouble(v)));
        SETTINGS_OPTIONS.put("zone-tolerance", (s, v) -> s.withZoneTolerancePct(parseDouble(v)));
        SETTINGS_OPTIONS.put("confluence-steps", (s, v) -> s.withConfluenceSteps(parseInt(v)));
        SETTINGS_OPTIONS.put("horizon-hours", (s, v) -> s.withForecastHorizonHours(parseInt(v)));
        SETTINGS_OPTIONS.put("step-minutes", (s, v) -> s.withStepMinutes(parseInt(v)));
        SETTINGS_OPTIONS.put("history-hours", (s, v) -> s.withSelectionLookbackHours(parseInt(v)));
        SETTINGS_OPTIONS.put("top-k", (s, v) -> s.withTopK(parseInt(v)));
        SETTINGS_OPTIONS.put("min-hist-accuracy", (s, v) -> s.withMinHistAccuracy(parseDouble(v)));
        SETTINGS_OPTIONS.put("min-hist-signals", (s, v) -> s.withMinHistSignals(parseInt(v)));
        SETTINGS_OPTIONS.put("volatility-factor", (s, v) -> s.withVolatilityFactor(parseDouble(v)));
        SETTINGS_OPTIONS.put("min-zone-strength", (s, v) -> s.withMinZoneStrength(parseInt(v)));
        SETTINGS_OPTIONS.put("min-occurrences", (s, v) -> s.withMinPredOccurrences(parseInt(v)));
        SETTINGS_OPTIONS.put("zone-min", (s, v) -> s.withZoneMinPct(parseDouble(v)));
        SETTINGS_OPTIONS.put("zone-max", (s, v) -> s.withZoneMaxPct(parseDouble(v)));
    }

    public static CommandLineOptions parse(String... args) {
        Path path = defaultPath();
        Mode mode = Mode.BACKTEST;
        int days = Config.BACKTEST_DAYS;
        Optional<LocalDate> startDay = Optional.empty();
        double target = Config.TARGET_ACCURACY;
        int maxResets = Config.MAX_RESETS;
        SeriesMode seriesMode = SeriesMode.AUTO;
        int maxRows = Config.SUMMARY_MAX_ROWS;
        Settings settings = Settings.defaults();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name;
            String inlineValue = null;
            if (arg.equals("-p")) {
                name = "path";
            } else if (arg.startsWith("--")) {
                int eq = arg.indexOf('=');
                name = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
                inlineValue = eq < 0 ? null : arg.substring(eq + 1);
            } else {
                throw new IllegalArgumentException("Неожиданный аргумент: " + arg);
            }

            switch (name) {
                case "help" -> mode = Mode.HELP;
                case "summary" -> mode = Mode.SUMMARY;
                case "auto-tune" -> mode = Mode.AUTO_TUNE;
                default -> {
                    String value;
                    if (inlineValue != null) {
                        value = inlineValue;
                    } else if (i + 1 < args.length) {
                        value = args[++i];
                    } else {
                        throw new IllegalArgumentException("Опции --" + name + " нужно значение");
                    }
                    switch (name) {
                        case "path" -> path = Path.of(value);
                        case "days" -> days = parseInt(value);
                        case "start-day" -> startDay = Optional.of(parseDate(value));
                        case "target" -> target = parseDouble(value);
                        case "max-resets" -> maxResets = parseInt(value);
                        case "series" -> seriesMode = parseSeriesMode(value);
                        case "max-rows" -> maxRows = parseInt(value);
                        default -> {
                            BiFunction<Settings, String, Settings> override = SETTINGS_OPTIONS.get(name);
                            if (override == null) {
                                throw new IllegalArgumentException("Неизвестная опция: --" + name);
                            }
                            settings = override.apply(settings, value);
                        }
                    }
                }
            }
        }
        if (days < 1) {
            throw new IllegalArgumentException("--days должен быть >= 1");
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("--max-rows должен быть >= 0");
        }
        return new CommandLineOptions(path, mode, days, startDay, target, maxResets, seriesMode, maxRows, settings);
    }

    public static String usage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Использование: zones-backtester [--path|-p FILE] [--summary | --auto-tune] [опции]\n");
        sb.append("  --days N            число опорных дней (по умолчанию ").append(Config.BACKTEST_DAYS).append(")\n");
        sb.append("  --start-day YYYY-MM-DD  стартовый опорный день (иначе эвристика)\n");
        sb.append("  --target X          целевая точность (по умолчанию ").append(Config.TARGET_ACCURACY).append(")\n");
        sb.append("  --max-resets N      лимит перекалибровок (по умолчанию ").append(Config.MAX_RESETS).append(")\n");
        sb.append("  --series auto|array|table  представление рядов\n");
        sb.append("  --max-rows N        символов в сводке\n");
        Settings.defaults().asOptions().forEach((name, value) ->
                sb.append(String.format(Locale.ROOT, "  --%-20s по умолчанию %s%n", name, value)));
        return sb.toString();
    }

    private static Path defaultPath() {
        Path workspace = Path.of("/workspace", Config.DEFAULT_DATA_FILE);
        return Files.exists(workspace) ? workspace : Path.of(Config.DEFAULT_DATA_FILE);
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Ожидалось целое число: " + value, e);
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Ожидалось число: " + value, e);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Ожидалась дата YYYY-MM-DD: " + value, e);
        }
    }

    private static SeriesMode parseSeriesMode(String value) {
        try {
            return SeriesMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--series: ожидалось auto, array или table, получено " + value, e);
        }
    }
}
