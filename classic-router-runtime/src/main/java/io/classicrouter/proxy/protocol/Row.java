/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Arrays;
import java.util.List;

/**
 * Row of a text resultset.
 *
 * @param fields the row's fields, SQL NULLs are {@link Value#NULL}
 */
public record Row(List<Value> fields) {

    public Row {
        fields = List.copyOf(fields);
    }

    public static Row of(Value... fields) {
        return new Row(Arrays.asList(fields));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    public Value get(int index) {
        return fields.get(index);
    }
}
