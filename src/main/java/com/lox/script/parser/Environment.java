package com.lox.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single flat scope. Declaring or assigning a name replaces any earlier binding.
 */
public class Environment {
    private final Map<String, Value> values = new LinkedHashMap<>();

    public void define(String name, Value value) {
        values.put(name, value);
    }

    /** Returns the current binding, or null when the name was never bound. */
    public Value get(String name) {
        return values.get(name);
    }

    public boolean exists(String name) {
        return values.containsKey(name);
    }

    /** Read-only copy of the bindings in first-definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
