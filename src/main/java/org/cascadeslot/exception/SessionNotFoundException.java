package org.cascadeslot.exception;

import java.util.Map;

public class SessionNotFoundException extends SlotEngineException {

    public SessionNotFoundException(String sessionId) {
        super("Session introuvable: " + sessionId, "NOT_FOUND", "NOT_FOUND",
                Map.of("sessionId", String.valueOf(sessionId)));
    }
}
