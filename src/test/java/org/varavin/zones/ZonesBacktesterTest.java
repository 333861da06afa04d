package org.varavin.zones;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.varavin.zones.entity.Candle;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.varavin.zones.TestCandles.*;

class ZonesBacktesterTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private Path writeCandles(Map<String, List<Candle>> data) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = mapper.createObjectNode();
        data.forEach((symbol, candles) -> {
            ArrayNode rows = root.putArray(symbol);
            for (Candle c : candles) {
                rows.addObject()
                        .put("from", c.time().getEpochSecond())
                        .put("open", c.open())
                        .put("max", c.high())
                        .put("min", c.low())
                        .put("close", c.close());
            }
        });
        Path file = tempDir.resolve("candles_data.json");
        mapper.writeValue(file.toFile(), root);
        return file;
    }

    private Path sixDays() throws IOException {
        return writeCandles(Map.of(
                "AAA", randomWalk(1, BASE, 6 * 288, 5, 100.0),
                "BBB", randomWalk(2, BASE, 6 * 288, 5, 40.0)));
    }

    @Test
    void missingFileExitsWithTwo() {
        int code = ZonesBacktester.run(out, "--path", tempDir.resolve("nope.json").toString());

        assertEquals(ZonesBacktester.EXIT_FILE_NOT_FOUND, code);
        assertTrue(output().contains("Файл не найден"));
    }

    @Test
    void malformedJsonExitsWithFour() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "[1, 2]", StandardCharsets.UTF_8);

        assertEquals(ZonesBacktester.EXIT_MALFORMED_INPUT, ZonesBacktester.run(out, "--path", file.toString()));
        assertEquals("", output());
    }

    @Test
    void singleDayOfDataExitsWithFive() throws IOException {
        Path file = writeCandles(Map.of("AAA", randomWalk(1, BASE, 100, 5, 100.0)));

        assertEquals(ZonesBacktester.EXIT_INSUFFICIENT_DAYS, ZonesBacktester.run(out, "-p", file.toString()));
    }

    @Test
    void windowLongerThanHistoryExitsWithFive() throws IOException {
        Path file = sixDays();

        int code = ZonesBacktester.run(out, "-p", file.toString(), "--days", "3", "--start-day", "2024-03-02");

        assertEquals(ZonesBacktester.EXIT_INSUFFICIENT_DAYS, code);
        assertEquals("", output());
    }

    @Test
    void badArgumentsExitWithOneAndPrintUsage() {
        assertEquals(ZonesBacktester.EXIT_ERROR, ZonesBacktester.run(out, "--no-such-option", "1"));
        assertTrue(output().contains("Использование"));
    }

    @Test
    void helpExitsWithZero() {
        assertEquals(ZonesBacktester.EXIT_OK, ZonesBacktester.run(out, "--help"));
        assertTrue(output().contains("--predominance-pct"));
    }

    @Test
    void summaryListsSymbols() throws IOException {
        Path file = sixDays();

        int code = ZonesBacktester.run(out, "--path=" + file, "--summary", "--max-rows", "1");

        assertEquals(ZonesBacktester.EXIT_OK, code);
        String text = output();
        assertTrue(text.contains("Всего символов: 2"));
        assertTrue(text.contains("Символы (первые 1)"));
        assertTrue(text.contains("Размер:"));
    }

    @Test
    void backtestPrintsDaysTotalsAndVerdict() throws IOException {
        Path file = sixDays();

        int code = ZonesBacktester.run(out, "-p", file.toString(), "--days", "3", "--series", "array");

        assertEquals(ZonesBacktester.EXIT_OK, code);
        String text = output();
        assertTrue(text.contains("== Результаты по дням =="));
        assertTrue(text.contains("2024-03-05 -> 2024-03-06"));
        assertTrue(text.contains("2024-03-03 -> 2024-03-04"));
        assertTrue(text.contains("== Итого =="));
        assertTrue(text.contains("УСТОЙЧИВО"));
    }

    @Test
    void startDayPrefersLatestFourteenthWithFollowingDay() {
        SortedSet<LocalDate> available = new TreeSet<>(List.of(
                LocalDate.of(2024, 3, 13), LocalDate.of(2024, 3, 14), LocalDate.of(2024, 3, 15),
                LocalDate.of(2024, 4, 14), LocalDate.of(2024, 4, 20)));

        assertEquals(LocalDate.of(2024, 3, 14), ZonesBacktester.chooseStartDay(available));
    }

    @Test
    void startDayFallsBackToSecondToLast() {
        SortedSet<LocalDate> available = new TreeSet<>(List.of(
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 3)));

        assertEquals(LocalDate.of(2024, 3, 2), ZonesBacktester.chooseStartDay(available));
        assertThrows(InsufficientHistoryException.class,
                () -> ZonesBacktester.chooseStartDay(new TreeSet<>(List.of(LocalDate.of(2024, 3, 1)))));
    }

    @Test
    void historyMustCoverTheWindow() {
        SortedSet<LocalDate> available = new TreeSet<>(List.of(
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 3)));

        assertDoesNotThrow(() -> ZonesBacktester.requireHistory(available, LocalDate.of(2024, 3, 2), 2));
        assertThrows(InsufficientHistoryException.class,
                () -> ZonesBacktester.requireHistory(available, LocalDate.of(2024, 3, 2), 3));
    }
}
