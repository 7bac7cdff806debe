package com.example.demo.sheetgen.tree;

/**
 * Anything that can be reduced to a {@link ValueMap}: a value map itself, or a
 * tree whose value is the sum of its leaves.
 */
public interface Valued<K> {

    ValueMap<K> value();
}
