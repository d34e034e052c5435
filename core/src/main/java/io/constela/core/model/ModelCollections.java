package io.constela.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defensive-copy helpers shared by the AST and IR records. Maps keep declaration order, which is
 * observable in compiled output and in style variant resolution.
 */
public final class ModelCollections {

    private ModelCollections() {
        // utility class
    }

    /** Immutable, order-preserving copy; {@code null} becomes an empty map. */
    public static <K, V> Map<K, V> orderedCopy(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Immutable copy; {@code null} becomes an empty list. */
    public static <T> List<T> listCopy(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }
}
