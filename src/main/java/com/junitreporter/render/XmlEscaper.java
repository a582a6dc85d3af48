package com.junitreporter.render;

/**
 * Escaping for hand-built XML text.
 *
 * Each method scans its input once, left to right, so every character is escaped
 * exactly once and {@code &} in already-escaped looking input is escaped again like
 * any other ampersand. Characters that XML 1.0 cannot represent at all (control
 * characters other than tab, newline and carriage return, e.g. ANSI colour escapes in
 * captured output) are dropped so the report always parses. A surrogate without its
 * partner becomes U+FFFD, since UTF-8 cannot encode it and the whole write would fail.
 * Carriage returns, and in attribute values also tabs and newlines, are written as
 * character references so they survive parsing.
 */
public final class XmlEscaper {

    private static final char REPLACEMENT = '\uFFFD';

    private XmlEscaper() {}

    /** Escapes element text content: {@code & < >} and carriage return. */
    public static String text(String s) {
        return escape(s, false);
    }

    /** Escapes an attribute value: {@code & < > " '} and tab, newline, carriage return. */
    public static String attribute(String s) {
        return escape(s, true);
    }

    private static String escape(String s, boolean attribute) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                sb.append(c).append(s.charAt(++i));
                continue;
            }
            switch (c) {
                case '&'  -> sb.append("&amp;");
                case '<'  -> sb.append("&lt;");
                case '>'  -> sb.append("&gt;");
                case '"'  -> sb.append(attribute ? "&quot;" : "\"");
                case '\'' -> sb.append(attribute ? "&apos;" : "'");
                // parsers normalize literal line ends, and attribute whitespace, on read
                case '\n' -> sb.append(attribute ? "&#10;" : "\n");
                case '\r' -> sb.append("&#13;");
                case '\t' -> sb.append(attribute ? "&#9;" : "\t");
                default -> {
                    if (Character.isSurrogate(c)) sb.append(REPLACEMENT);
                    else if (isXmlChar(c)) sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    private static boolean isXmlChar(char c) {
        return (c >= 0x20 && c <= 0xD7FF) || (c >= 0xE000 && c <= 0xFFFD);
    }
}
