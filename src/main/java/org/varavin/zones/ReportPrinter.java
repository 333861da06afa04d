package org.varavin.zones;

import org.varavin.zones.entity.BacktestResult;
import org.varavin.zones.entity.CalibrationAttempt;
import org.varavin.zones.entity.ConsistencyResult;
import org.varavin.zones.entity.DayResult;
import org.varavin.zones.entity.Settings;
import org.varavin.zones.entity.SymbolStats;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Текстовый отчёт в stdout. Диагностика идёт в лог, сюда - только результат.
 */
public class ReportPrinter {

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    static void section(PrintStream out, String title) {
        out.printf("%n== %s ==%n", title);
    }

    public void fileInfo(Path path, long sizeBytes) {
        section(out, "Файл");
        out.printf("Путь: %s%n", path.toAbsolutePath());
        out.printf("Размер: %s%n", DataSummary.humanBytes(sizeBytes));
    }

    public void backtest(BacktestResult result) {
        section(out, "Результаты по дням");
        for (DayResult day : result.days()) {
            out.printf(Locale.ROOT, "%s -> %s | активы %s%s | сигналов %d | оценено %d | G0 %d | G1 %d | loss %d | без данных %d | точность %s%n",
                    day.referenceDay(), day.predictionDay(), day.selectedSymbols(),
                    day.selectionFallback() ? " (вся вселенная)" : "",
                    day.signals(), day.evaluated(),
                    day.symbols().stream().mapToInt(SymbolStats::winsG0).sum(),
                    day.symbols().stream().mapToInt(SymbolStats::winsG1).sum(),
                    day.losses(), day.noData(),
                    day.hasEvaluated() ? percent(day.accuracy()) : "-");
        }
        section(out, "Итого");
        out.printf("Дней: %d, с сигналами: %d%n", result.days().size(), result.daysWithSignals());
        out.printf("Сигналов: %d, оценено: %d%n", result.totalSignals(), result.totalEvaluated());
        out.printf("Средняя точность по дням: %s%n", percent(result.meanAccuracy()));
        out.printf("Общая точность: %s%n", percent(result.pooledAccuracy()));
    }

    public void settings(Settings settings) {
        section(out, "Параметры");
        settings.asOptions().forEach((name, value) -> out.printf(Locale.ROOT, "  %-20s %s%n", name, value));
    }

    public void consistency(ConsistencyResult result, double targetAccuracy) {
        if (!result.attempts().isEmpty()) {
            section(out, "Перекалибровки");
            for (CalibrationAttempt attempt : result.attempts()) {
                out.printf("#%d: провал на %s, калибровка на %s, кандидатов %d, точность %s, оценено %d%s%n",
                        attempt.reset(), attempt.failingReferenceDay(), attempt.calibration().calibrationDay(),
                        attempt.calibration().candidatesTried(), percent(attempt.calibration().accuracy()),
                        attempt.calibration().evaluated(), attempt.calibration().targetMet() ? "" : " (цель не достигнута)");
            }
        }
        backtest(result.run());
        settings(result.finalSettings());
        verdict(result.consistent(), targetAccuracy,
                result.method() == ConsistencyResult.Method.FIXED_GRID
                        ? "проверенный набор"
                        : "адаптивный поиск, перекалибровок " + result.resets());
    }

    public void verdict(boolean consistent, double targetAccuracy, String how) {
        section(out, "Вердикт");
        out.printf("%s (цель %s, %s)%n",
                consistent ? "УСТОЙЧИВО" : "НЕ УСТОЙЧИВО", percent(targetAccuracy), how);
    }

    static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value * 100);
    }
}
