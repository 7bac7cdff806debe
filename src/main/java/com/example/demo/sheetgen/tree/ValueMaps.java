package com.example.demo.sheetgen.tree;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Key-wise arithmetic over {@link ValueMap}s. A key missing from an operand
 * contributes zero (or the supplied identity), never an error.
 */
public final class ValueMaps {

    private ValueMaps() {
    }

    public static <K> ValueMap<K> sum(ValueMap<K> left, ValueMap<K> right) {
        return sum(Arrays.asList(left, right));
    }

    @SafeVarargs
    public static <K> ValueMap<K> sum(ValueMap<K>... maps) {
        return sum(Arrays.asList(maps));
    }

    public static <K> ValueMap<K> sum(List<ValueMap<K>> maps) {
        LinkedHashMap<K, BigDecimal> acc = new LinkedHashMap<>();
        for (ValueMap<K> m : maps) {
            for (Map.Entry<K, BigDecimal> e : m.asMap().entrySet()) {
                acc.merge(e.getKey(), e.getValue(), BigDecimal::add);
            }
        }
        return ValueMap.wrap(acc);
    }

    public static <K> ValueMap<K> negate(ValueMap<K> m) {
        LinkedHashMap<K, BigDecimal> out = new LinkedHashMap<>();
        for (Map.Entry<K, BigDecimal> e : m.asMap().entrySet()) {
            out.put(e.getKey(), e.getValue().negate());
        }
        return ValueMap.wrap(out);
    }

    public static <K> ValueMap<K> subtract(ValueMap<K> minuend, ValueMap<K> subtrahend) {
        return sum(minuend, negate(subtrahend));
    }

    /**
     * {@code first + negate(rest[0]) + negate(rest[1]) + ...}. Keys that only
     * appear in the subtrahends come out negative.
     */
    @SafeVarargs
    public static <K> ValueMap<K> subtract(ValueMap<K> first, ValueMap<K>... rest) {
        ValueMap<K> acc = first;
        for (ValueMap<K> m : rest) {
            acc = subtract(acc, m);
        }
        return acc;
    }

    /**
     * Apply {@code f} key by key over the union of keys, substituting
     * {@code identity} for whichever side lacks the key.
     */
    public static <K> ValueMap<K> combine(BinaryOperator<BigDecimal> f, BigDecimal identity,
                                          ValueMap<K> left, ValueMap<K> right) {
        Set<K> keys = new LinkedHashSet<>(left.keySet());
        keys.addAll(right.keySet());
        LinkedHashMap<K, BigDecimal> out = new LinkedHashMap<>();
        for (K k : keys) {
            BigDecimal l = left.containsKey(k) ? left.get(k) : identity;
            BigDecimal r = right.containsKey(k) ? right.get(k) : identity;
            out.put(k, f.apply(l, r));
        }
        return ValueMap.wrap(out);
    }

    /**
     * {@link #combine} curried into an operator over whole maps.
     */
    public static <K> BinaryOperator<ValueMap<K>> combiner(BinaryOperator<BigDecimal> f, BigDecimal identity) {
        return (left, right) -> combine(f, identity, left, right);
    }
}
