package com.junitreporter.render;

/**
 * Readable representation of expected/actual values in a failure body.
 * Strings are quoted so {@code "2"} and {@code 2} stay distinguishable.
 */
final class ValueRepr {

    private ValueRepr() {}

    static String of(Object value) {
        if (value == null) return "null";
        if (value instanceof CharSequence cs) {
            StringBuilder sb = new StringBuilder(cs.length() + 2).append('"');
            for (int i = 0; i < cs.length(); i++) {
                char c = cs.charAt(i);
                if (c == '"' || c == '\\') sb.append('\\');
                sb.append(c);
            }
            return sb.append('"').toString();
        }
        return String.valueOf(value);
    }
}
