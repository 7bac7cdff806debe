package com.example.demo.sheetgen.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, insertion ordered map from a column key to a decimal amount.
 *
 * Keys that are not present count as zero, and equality follows the same rule:
 * {@code {a: 0}} equals the empty map, and {@code {a: 1.0}} equals {@code {a: 1}}.
 */
public final class ValueMap<K> implements Valued<K> {

    private static final ValueMap<Object> EMPTY = new ValueMap<>(new LinkedHashMap<>());

    private final Map<K, BigDecimal> values;

    private ValueMap(LinkedHashMap<K, BigDecimal> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    @SuppressWarnings("unchecked")
    public static <K> ValueMap<K> empty() {
        return (ValueMap<K>) EMPTY;
    }

    public static <K> ValueMap<K> of(K key, Number value) {
        LinkedHashMap<K, BigDecimal> m = new LinkedHashMap<>();
        put(m, key, value);
        return new ValueMap<>(m);
    }

    public static <K> ValueMap<K> of(K k1, Number v1, K k2, Number v2) {
        LinkedHashMap<K, BigDecimal> m = new LinkedHashMap<>();
        put(m, k1, v1);
        put(m, k2, v2);
        return new ValueMap<>(m);
    }

    public static <K> ValueMap<K> of(K k1, Number v1, K k2, Number v2, K k3, Number v3) {
        LinkedHashMap<K, BigDecimal> m = new LinkedHashMap<>();
        put(m, k1, v1);
        put(m, k2, v2);
        put(m, k3, v3);
        return new ValueMap<>(m);
    }

    /**
     * Copy an arbitrary map of numbers, keeping its iteration order.
     */
    public static <K> ValueMap<K> from(Map<? extends K, ? extends Number> source) {
        Objects.requireNonNull(source, "source map");
        LinkedHashMap<K, BigDecimal> m = new LinkedHashMap<>();
        for (Map.Entry<? extends K, ? extends Number> e : source.entrySet()) {
            put(m, e.getKey(), e.getValue());
        }
        return new ValueMap<>(m);
    }

    /**
     * A map holding zero for each of the given keys.
     */
    public static <K> ValueMap<K> zeros(Collection<? extends K> keys) {
        LinkedHashMap<K, BigDecimal> m = new LinkedHashMap<>();
        for (K key : keys) {
            m.put(Objects.requireNonNull(key, "value map key"), BigDecimal.ZERO);
        }
        return new ValueMap<>(m);
    }

    /**
     * Takes ownership of an already validated map. Callers must not touch it afterwards.
     */
    static <K> ValueMap<K> wrap(LinkedHashMap<K, BigDecimal> owned) {
        return owned.isEmpty() ? empty() : new ValueMap<>(owned);
    }

    private static <K> void put(Map<K, BigDecimal> m, K key, Number value) {
        Objects.requireNonNull(key, "value map key");
        Objects.requireNonNull(value, () -> "value for key '" + key + "'");
        m.put(key, toDecimal(value));
    }

    public static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        // Float/Double/anything else: go through the shortest decimal representation
        return BigDecimal.valueOf(n.doubleValue());
    }

    /**
     * The amount for the key, or zero when absent.
     */
    public BigDecimal get(Object key) {
        BigDecimal v = values.get(key);
        return v == null ? BigDecimal.ZERO : v;
    }

    public boolean containsKey(Object key) {
        return values.containsKey(key);
    }

    public Set<K> keySet() {
        return values.keySet();
    }

    public Map<K, BigDecimal> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public ValueMap<K> value() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueMap)) {
            return false;
        }
        ValueMap<?> other = (ValueMap<?>) o;
        for (Map.Entry<K, BigDecimal> e : values.entrySet()) {
            if (e.getValue().compareTo(other.get(e.getKey())) != 0) {
                return false;
            }
        }
        for (Map.Entry<?, BigDecimal> e : other.values.entrySet()) {
            if (e.getValue().compareTo(get(e.getKey())) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<K, BigDecimal> e : values.entrySet()) {
            if (e.getValue().signum() != 0) {
                h += e.getKey().hashCode() ^ e.getValue().stripTrailingZeros().hashCode();
            }
        }
        return h;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
