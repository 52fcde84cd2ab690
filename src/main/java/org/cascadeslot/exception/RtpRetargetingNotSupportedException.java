package org.cascadeslot.exception;

import java.util.Map;

public class RtpRetargetingNotSupportedException extends SlotEngineException {

    public RtpRetargetingNotSupportedException(String message) {
        this(message, null);
    }

    public RtpRetargetingNotSupportedException(String message, Map<String, Object> details) {
        super(message, "UNSUPPORTED_OPERATION", "UNSUPPORTED_OPERATION", details);
    }
}
