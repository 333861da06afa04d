package org.varavin.zones;

/**
 * Входной файл имеет неверную структуру (код выхода 4).
 */
public class CandleDataException extends RuntimeException {
    public CandleDataException(String message) {
        super(message);
    }

    public CandleDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
