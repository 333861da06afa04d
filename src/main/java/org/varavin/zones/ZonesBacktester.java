package org.varavin.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.BacktestResult;
import org.varavin.zones.entity.Candle;
import org.varavin.zones.entity.ConsistencyResult;
import org.varavin.zones.series.CandleSeries;
import org.varavin.zones.series.CandleSeriesFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

public class ZonesBacktester {
    private static final Logger log = LoggerFactory.getLogger(ZonesBacktester.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_FILE_NOT_FOUND = 2;
    public static final int EXIT_MISSING_CAPABILITY = 3;
    public static final int EXIT_MALFORMED_INPUT = 4;
    public static final int EXIT_INSUFFICIENT_DAYS = 5;

    public static void main(String[] args) {
        System.exit(run(System.out, args));
    }

    public static int run(PrintStream out, String... args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Ошибка в аргументах: {}", e.getMessage());
            out.print(CommandLineOptions.usage());
            return EXIT_ERROR;
        }
        if (options.mode() == CommandLineOptions.Mode.HELP) {
            out.print(CommandLineOptions.usage());
            return EXIT_OK;
        }
        if (!Files.exists(options.path())) {
            out.printf("Файл не найден: %s%n", options.path());
            return EXIT_FILE_NOT_FOUND;
        }

        ReportPrinter report = new ReportPrinter(out);
        try {
            long sizeBytes = Files.size(options.path());
            Map<String, List<Candle>> raw = new CandleDataLoader().load(options.path());

            if (options.mode() == CommandLineOptions.Mode.SUMMARY) {
                report.fileInfo(options.path(), sizeBytes);
                DataSummary.print(out, raw, options.maxRows());
                return EXIT_OK;
            }

            CandleSeriesFactory factory = new CandleSeriesFactory(options.seriesMode(),
                    Duration.ofMinutes(options.settings().stepMinutes()));
            log.info("Представление рядов: {}", factory.effectiveMode());
            Map<String, CandleSeries> universe = CandleDataLoader.toSeries(raw, factory);

            SortedSet<LocalDate> available = availableDays(universe);
            LocalDate startDay = options.startDay().orElseGet(() -> chooseStartDay(available));
            requireHistory(available, startDay, options.days());
            // отчёт начинается только после проверки входных данных
            report.fileInfo(options.path(), sizeBytes);

            RunContext ctx = new RunContext(options.settings(), universe);
            BacktestRunner runner = new BacktestRunner(true);
            List<LocalDate> days = BacktestRunner.referenceDays(startDay, options.days());
            log.info("Старт {}, дней {}, символов {}", startDay, options.days(), universe.size());

            if (options.mode() == CommandLineOptions.Mode.AUTO_TUNE) {
                ConsistencyOrchestrator orchestrator =
                        new ConsistencyOrchestrator(runner, new ParameterCalibrator(new BacktestRunner(false)));
                ConsistencyResult result = orchestrator
                        .consistencyGridSearch(ctx, days, options.targetAccuracy())
                        .orElseGet(() -> orchestrator.run(ctx, days, options.targetAccuracy(), options.maxResets()));
                report.consistency(result, options.targetAccuracy());
            } else {
                BacktestResult result = runner.run(ctx, days);
                report.backtest(result);
                report.settings(result.settings());
                boolean consistent = result.days().stream().allMatch(d -> d.meets(options.targetAccuracy()));
                report.verdict(consistent, options.targetAccuracy(), "одиночный прогон");
            }
            return EXIT_OK;
        } catch (CandleDataException e) {
            log.error("Некорректные входные данные: {}", e.getMessage());
            return EXIT_MALFORMED_INPUT;
        } catch (MissingCapabilityException e) {
            log.error("{}", e.getMessage());
            return EXIT_MISSING_CAPABILITY;
        } catch (InsufficientHistoryException e) {
            log.error("Недостаточно истории: {}", e.getMessage());
            return EXIT_INSUFFICIENT_DAYS;
        } catch (IOException e) {
            log.error("Ошибка чтения файла {}: ", options.path(), e);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            log.error("Непредвиденная ошибка: ", e);
            return EXIT_ERROR;
        }
    }

    static SortedSet<LocalDate> availableDays(Map<String, CandleSeries> universe) {
        SortedSet<LocalDate> days = new TreeSet<>();
        universe.values().forEach(series -> days.addAll(series.days()));
        return days;
    }

    /**
     * Последний день с числом START_DAY_OF_MONTH, за которым в данных есть следующий день;
     * иначе предпоследний доступный день.
     */
    static LocalDate chooseStartDay(SortedSet<LocalDate> available) {
        if (available.size() < 2) {
            throw new InsufficientHistoryException("Нужно хотя бы два дня данных, найдено " + available.size());
        }
        List<LocalDate> ordered = new ArrayList<>(available);
        for (int i = ordered.size() - 1; i >= 0; i--) {
            LocalDate day = ordered.get(i);
            if (day.getDayOfMonth() == Config.START_DAY_OF_MONTH && available.contains(day.plusDays(1))) {
                return day;
            }
        }
        return ordered.get(ordered.size() - 2);
    }

    /**
     * Дней с данными не позже стартового должно хватать на всё окно.
     */
    static void requireHistory(SortedSet<LocalDate> available, LocalDate startDay, int numDays) {
        int upToStart = available.headSet(startDay.plusDays(1)).size();
        if (upToStart < numDays) {
            throw new InsufficientHistoryException(String.format(
                    "для окна в %d дней до %s найдено только %d дней с данными", numDays, startDay, upToStart));
        }
    }
}
