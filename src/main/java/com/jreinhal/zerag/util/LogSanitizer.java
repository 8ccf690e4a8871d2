package com.jreinhal.zerag.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters would let user text forge extra log lines.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int PREFIX_LENGTH = 40;

    private LogSanitizer() {
    }

    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Short single-line prefix of a question, for failure logs that must be traceable.
     */
    public static String prefix(String value) {
        String clean = sanitize(value);
        return clean.length() > PREFIX_LENGTH ? clean.substring(0, PREFIX_LENGTH) + "..." : clean;
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }
}
