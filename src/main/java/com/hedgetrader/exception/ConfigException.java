package com.hedgetrader.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown at startup when the accounts or trading pairs configuration is structurally
 * invalid. Fatal: the application context refuses to start.
 */
public class ConfigException extends BaseException {

    public ConfigException(String message) {
        super(ErrorCode.CONFIG_INVALID, message);
    }

    public ConfigException(List<String> errors) {
        super(ErrorCode.CONFIG_INVALID, "Invalid trading configuration: " + String.join("; ", errors),
                Map.of("errors", List.copyOf(errors)));
    }
}
