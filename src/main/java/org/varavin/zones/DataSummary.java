package org.varavin.zones;

import org.varavin.zones.entity.Candle;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Краткая сводка содержимого файла свечей (режим --summary).
 */
public final class DataSummary {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private DataSummary() {
    }

    public static String humanBytes(long bytes) {
        double size = bytes;
        for (String unit : UNITS) {
            if (size < 1024.0) {
                return String.format(Locale.ROOT, "%.2f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.2f PB", size);
    }

    public static void print(PrintStream out, Map<String, List<Candle>> data, int maxRows) {
        ReportPrinter.section(out, "Сводка по символам");
        List<String> symbols = new ArrayList<>(data.keySet());
        out.printf("Всего символов: %d%n", symbols.size());
        List<String> shown = symbols.subList(0, Math.min(maxRows, symbols.size()));
        out.printf("Символы (первые %d): %s%n", shown.size(), shown);
        for (String symbol : shown) {
            List<Candle> candles = data.get(symbol);
            out.printf("  - %s: свечей %d", symbol, candles.size());
            if (!candles.isEmpty()) {
                Candle first = candles.stream().min((a, b) -> a.time().compareTo(b.time())).orElseThrow();
                Candle last = candles.stream().max((a, b) -> a.time().compareTo(b.time())).orElseThrow();
                out.printf(", период %s -> %s", first.time(), last.time());
            }
            out.println();
        }
    }
}
