package org.varavin.zones;

/**
 * Для запрошенного окна не хватает календарных дней (код выхода 5).
 */
public class InsufficientHistoryException extends RuntimeException {
    public InsufficientHistoryException(String message) {
        super(message);
    }
}
