/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import io.classicrouter.proxy.protocol.Value;

/**
 * Session system-variables of a client connection, as the client expects them to be set on
 * whichever server it is connected to.
 * <p>
 * Variables are iterated in order of their names. A variable set to SQL NULL is different from a
 * variable that isn't tracked at all: {@link #find(String)} tells them apart.
 * </p>
 */
public class SystemVariables implements Iterable<Map.Entry<String, Value>> {

    private final Map<String, Value> variables = new TreeMap<>();

    /**
     * Sets or replaces a variable.
     */
    public void set(String name, Value value) {
        variables.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
    }

    /**
     * @return the value of the variable, or {@link Value#NULL} if it isn't tracked
     */
    public Value get(String name) {
        return variables.getOrDefault(name, Value.NULL);
    }

    /**
     * @return the value of the variable, empty if it isn't tracked
     */
    public Optional<Value> find(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public int size() {
        return variables.size();
    }

    @Override
    public Iterator<Map.Entry<String, Value>> iterator() {
        return Collections.unmodifiableMap(variables).entrySet().iterator();
    }

    @Override
    public String toString() {
        return "SystemVariables" + variables;
    }
}
