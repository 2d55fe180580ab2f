package io.procjobs.backend.util;

import java.util.regex.Pattern;

/**
 * Input sanitization for values that end up in application logs.
 * Query strings, Prefer headers and runner messages are caller-controlled and may carry
 * control characters meant to forge log entries.
 */
public class SecurityUtils {

    // Pattern to match potentially dangerous characters for logging
    private static final Pattern DANGEROUS_LOG_CHARS = Pattern.compile("[\\r\\n\\t\\x00-\\x1F\\x7F-\\x9F]");

    private static final int MAX_LOG_VALUE_LENGTH = 200;

    private SecurityUtils() {
    }

    /**
     * Sanitizes a caller-supplied string for safe logging.
     *
     * @param input the string to sanitize
     * @return sanitized string, never null
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        if (input.isEmpty()) {
            return "empty";
        }

        String sanitized = DANGEROUS_LOG_CHARS.matcher(input).replaceAll("_");

        if (sanitized.length() > MAX_LOG_VALUE_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_VALUE_LENGTH - 3) + "...";
        }
        return sanitized;
    }

    public static String sanitizeForLogging(Object input) {
        return sanitizeForLogging(input == null ? null : String.valueOf(input));
    }
}
