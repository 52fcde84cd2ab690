package org.cascadeslot.exception;

import java.util.Collections;
import java.util.Map;

public abstract class SlotEngineException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    protected SlotEngineException(String message, String errorCode, String defaultCode, Map<String, Object> details) {
        super(message);
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? defaultCode : errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
