/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * Column definition of a resultset.
 *
 * @param schema schema of the column's table, may be empty
 * @param table table or alias of the column, may be empty
 * @param name name or alias of the column
 */
public record ColumnMeta(String schema, String table, String name) {

    public static ColumnMeta named(String name) {
        return new ColumnMeta("", "", name);
    }
}
