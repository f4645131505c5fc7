package com.phillippitts.tagprobe.util;

import java.nio.charset.StandardCharsets;

/** Utility for log- and message-safe rendering of raw stream bytes. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Renders bytes as text, printable ASCII as-is and everything else as {@code \xNN}.
     * At most {@code max} bytes are rendered; returns "" for null.
     */
    public static String printable(byte[] bytes, int max) {
        if (bytes == null || max <= 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        int n = Math.min(bytes.length, max);
        for (int i = 0; i < n; i++) {
            int c = bytes[i] & 0xFF;
            if (c >= 0x20 && c < 0x7F) {
                sb.append((char) c);
            } else {
                sb.append(String.format("\\x%02x", c));
            }
        }
        return sb.toString();
    }

    /**
     * Same as {@link #printable(byte[], int)} for a string read as ISO-8859-1.
     */
    public static String printable(String s) {
        if (s == null) {
            return "";
        }
        return printable(s.getBytes(StandardCharsets.ISO_8859_1), s.length());
    }
}
