package io.constela.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named class-string preset with variant tables, e.g. a button with {@code size} and {@code
 * color} variants.
 *
 * @param base            classes always applied
 * @param variants        variant key to (variant value to class string), in declaration order
 * @param defaultVariants value used for a variant key the expression does not supply
 */
public record StylePreset(
        String base, Map<String, Map<String, String>> variants, Map<String, String> defaultVariants) {

    public StylePreset {
        base = base == null ? "" : base;
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (variants != null) {
            variants.forEach((key, table) -> copy.put(key, ModelCollections.orderedCopy(table)));
        }
        variants = Collections.unmodifiableMap(copy);
        defaultVariants = ModelCollections.orderedCopy(defaultVariants);
    }

    public StylePreset(String base) {
        this(base, null, null);
    }

    public boolean hasVariant(String key) {
        return variants.containsKey(key);
    }

    /** Class string for one variant value, or {@code null}. */
    public String classFor(String key, String value) {
        Map<String, String> table = variants.get(key);
        return table == null ? null : table.get(value);
    }
}
