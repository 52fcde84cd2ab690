package org.cascadeslot.exception;

import java.util.Map;

public class InvalidBetException extends SlotEngineException {

    public InvalidBetException(String message) {
        this(message, null);
    }

    public InvalidBetException(String message, Map<String, Object> details) {
        super(message, "INVALID_BET", "INVALID_BET", details);
    }
}
