package org.varavin.zones;

/**
 * Запрошена возможность, для которой нет нужной библиотеки (код выхода 3).
 */
public class MissingCapabilityException extends RuntimeException {
    public MissingCapabilityException(String message) {
        super(message);
    }
}
