package com.tracegate.proxy.core.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Mutable, case-insensitive HTTP header multimap.
 * <p>
 * Each name maps to an ordered list of values; duplicate values are kept.
 * The first spelling of a name that is inserted is the one reported by
 * {@link #names()}. Two maps are equal when they hold the same values under the
 * same names, ignoring name case.
 * </p>
 */
public final class HeaderMap {

    private final TreeMap<String, List<String>> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public HeaderMap() {
    }

    /**
     * Creates a deep copy of another header map.
     * 
     * @param other The map to copy.
     */
    public HeaderMap(HeaderMap other) {
        other.values.forEach((name, list) -> values.put(name, new ArrayList<>(list)));
    }

    /**
     * Creates a header map from a plain multimap, such as
     * {@code java.net.http.HttpHeaders#map()}.
     * 
     * @param map Source multimap; null values are skipped.
     * @return A new header map.
     */
    public static HeaderMap of(Map<String, List<String>> map) {
        HeaderMap headers = new HeaderMap();
        map.forEach((name, list) -> {
            if (name != null && list != null) {
                list.forEach(v -> headers.add(name, v));
            }
        });
        return headers;
    }

    /**
     * Appends a value to the given header.
     */
    public HeaderMap add(String name, String value) {
        values.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Replaces all values of the given header with a single value.
     */
    public HeaderMap set(String name, String value) {
        List<String> list = new ArrayList<>();
        list.add(value);
        values.remove(name);
        values.put(name, list);
        return this;
    }

    /**
     * Replaces all values of the given header. An empty list removes it.
     */
    public HeaderMap put(String name, List<String> newValues) {
        values.remove(name);
        if (!newValues.isEmpty()) {
            values.put(name, new ArrayList<>(newValues));
        }
        return this;
    }

    public HeaderMap remove(String name) {
        values.remove(name);
        return this;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * @return The first value of the header, or null if absent.
     */
    public String first(String name) {
        List<String> list = values.get(name);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    /**
     * @return All values of the header in insertion order; empty if absent.
     */
    public List<String> get(String name) {
        List<String> list = values.get(name);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * Calls the consumer once per header value, in name order then value order.
     */
    public void forEachValue(BiConsumer<String, String> consumer) {
        values.forEach((name, list) -> list.forEach(v -> consumer.accept(name, v)));
    }

    /**
     * @return An immutable snapshot as an ordered plain multimap.
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        values.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        // TreeMap equality resolves keys through the other map's comparator.
        return values.equals(((HeaderMap) o).values);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, List<String>> e : values.entrySet()) {
            h += e.getKey().toLowerCase(Locale.ROOT).hashCode() ^ e.getValue().hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
