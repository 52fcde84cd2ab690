package org.cascadeslot.exception;

import java.util.Map;

/**
 * Configuration rejetée à la construction ou à la reconfiguration du moteur.
 * L'état du moteur n'est jamais modifié quand elle est levée.
 */
public class InvalidConfigException extends SlotEngineException {

    public static final String INVALID_CONFIG = "INVALID_CONFIG";
    public static final String INVALID_RTP = "INVALID_RTP";
    public static final String INVALID_REEL_STRIPS = "INVALID_REEL_STRIPS";
    public static final String INVALID_PAY_TABLE = "INVALID_PAY_TABLE";

    public InvalidConfigException(String message) {
        this(message, INVALID_CONFIG, null);
    }

    public InvalidConfigException(String message, Map<String, Object> details) {
        this(message, INVALID_CONFIG, details);
    }

    public InvalidConfigException(String message, String errorCode, Map<String, Object> details) {
        super(message, errorCode, INVALID_CONFIG, details);
    }
}
