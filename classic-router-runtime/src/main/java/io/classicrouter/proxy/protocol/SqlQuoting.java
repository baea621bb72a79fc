/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * Quoting of literals and identifiers embedded in administrative statements.
 */
public final class SqlQuoting {

    private static final char ESCAPE = '\\';

    private SqlQuoting() {
    }

    /**
     * Surrounds {@code s} with {@code delimiter}, escaping occurrences of the delimiter and of
     * the backslash with a backslash.
     *
     * @param s text to quote
     * @param delimiter quote character, like {@code '}, {@code "} or {@code `}
     * @return quoted text
     */
    public static String quoted(String s, char delimiter) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append(delimiter);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == delimiter || c == ESCAPE) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        sb.append(delimiter);
        return sb.toString();
    }
}
