/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A nullable scalar as exchanged with the server, for example the value of a system-variable.
 * <p>
 * A {@code Value} holding {@code null} is the SQL {@code NULL}. It is distinct from a value that
 * isn't known at all, which is expressed by an empty {@link Optional} where that matters.
 * </p>
 *
 * @param value the value as text, or null for SQL NULL
 */
public record Value(@Nullable String value) {

    public static final Value NULL = new Value(null);

    public static Value of(String value) {
        return new Value(value);
    }

    public boolean isNull() {
        return value == null;
    }

    public Optional<String> asOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Renders the value as a SQL literal: {@code NULL} or a single-quoted string.
     */
    public String toSqlLiteral() {
        return value == null ? "NULL" : SqlQuoting.quoted(value, '\'');
    }

    @Override
    public String toString() {
        return toSqlLiteral();
    }
}
