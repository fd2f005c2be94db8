package com.williamcallahan.notewiki.service.tex;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Assigns 1-based numbers to keys in first-seen order; a repeated key keeps its number.
 *
 * @param <K> key type
 */
public final class SequenceRegistry<K> {

    private final Map<K, Integer> numbers = new LinkedHashMap<>();

    /**
     * Registers {@code key}, returning its existing number or the next free one.
     */
    public int register(K key) {
        Objects.requireNonNull(key, "Registry key cannot be null");
        return numbers.computeIfAbsent(key, ignored -> numbers.size() + 1);
    }

    /**
     * Returns the number of {@code key} without registering it.
     */
    public OptionalInt numberOf(K key) {
        Integer number = numbers.get(key);
        return number == null ? OptionalInt.empty() : OptionalInt.of(number);
    }

    /**
     * Returns registered keys in number order.
     */
    public List<K> keys() {
        return List.copyOf(numbers.keySet());
    }

    public int size() {
        return numbers.size();
    }

    public boolean isEmpty() {
        return numbers.isEmpty();
    }
}
