package com.phillippitts.voicebridge.util;

/** Utility for privacy-safe logging of text previews and credentials. */
public final class LogSanitizer {

    /** Default preview length for synthesized text. */
    public static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Preview of caller text for log lines, with an ellipsis when truncated.
     */
    public static String preview(String s) {
        String cut = truncate(s, DEFAULT_PREVIEW);
        return s != null && s.length() > DEFAULT_PREVIEW ? cut + "..." : cut;
    }

    /**
     * Masks a secret, keeping only its last four characters when it is long enough.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 8) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
