package com.relayjobs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RelayException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> details;

    public RelayException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public RelayException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public RelayException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
