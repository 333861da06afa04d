package org.varavin.zones;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.varavin.zones.entity.Candle;
import org.varavin.zones.series.CandleSeries;
import org.varavin.zones.series.CandleSeriesFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Чтение свечей из JSON: объект "символ -> массив записей".
 * Запись: from (epoch, секунды UTC), open, close и max/min либо high/low.
 * Если high/low нет ни под одним именем, берётся open.
 */
public class CandleDataLoader {
    private static final Logger log = LoggerFactory.getLogger(CandleDataLoader.class);

    private final ObjectMapper mapper;

    public CandleDataLoader() {
        this(new ObjectMapper());
    }

    public CandleDataLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, List<Candle>> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new CandleDataException("Файл не является корректным JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public Map<String, List<Candle>> parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CandleDataException("Ожидался объект 'символ -> список свечей', получено: "
                    + (root == null ? "пусто" : root.getNodeType()));
        }
        Map<String, List<Candle>> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String symbol = entry.getKey();
            JsonNode records = entry.getValue();
            if (!records.isArray()) {
                throw new CandleDataException("Значение для символа " + symbol + " должно быть массивом, получено: "
                        + records.getNodeType());
            }
            List<Candle> candles = new ArrayList<>(records.size());
            int skipped = 0;
            for (JsonNode row : records) {
                Candle candle = toCandle(row);
                if (candle == null) {
                    skipped++;
                } else {
                    candles.add(candle);
                }
            }
            if (skipped > 0) {
                log.warn("{}: пропущено {} некорректных записей", symbol, skipped);
            }
            result.put(symbol, candles);
        }
        log.info("Загружено символов: {}", result.size());
        return result;
    }

    public Map<String, CandleSeries> loadSeries(Path path, CandleSeriesFactory factory) throws IOException {
        return toSeries(load(path), factory);
    }

    public static Map<String, CandleSeries> toSeries(Map<String, List<Candle>> raw, CandleSeriesFactory factory) {
        Map<String, CandleSeries> universe = new LinkedHashMap<>();
        raw.forEach((symbol, candles) -> universe.put(symbol, factory.create(symbol, candles)));
        return universe;
    }

    static Candle toCandle(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        OptionalDouble from = number(row, "from");
        OptionalDouble open = number(row, "open");
        OptionalDouble close = number(row, "close");
        if (from.isEmpty() || open.isEmpty() || close.isEmpty()) {
            return null;
        }
        double o = open.getAsDouble();
        double high = number(row, "max").orElse(number(row, "high").orElse(o));
        double low = number(row, "min").orElse(number(row, "low").orElse(o));
        Instant time = Instant.ofEpochSecond((long) from.getAsDouble());
        return new Candle(time, o, high, low, close.getAsDouble());
    }

    private static OptionalDouble number(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return OptionalDouble.empty();
        }
        if (node.isNumber()) {
            return OptionalDouble.of(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.textValue().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }
}
