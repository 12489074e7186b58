package com.fun.compute.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated instance list filters. Values are already converted: {@code local_zone_only} and
 * {@code deleted} defaults are booleans, {@code vm_state} is a {@link VmState}, {@code changes-since}
 * is an {@link java.time.Instant}.
 */
public record SearchOptions(Map<String, Object> filters) {

    public SearchOptions {
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public Object get(String name) {
        return filters.get(name);
    }

    public boolean contains(String name) {
        return filters.containsKey(name);
    }
}
