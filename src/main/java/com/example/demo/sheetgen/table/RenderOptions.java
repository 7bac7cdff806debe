package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.tree.ValueMap;
import com.example.demo.sheetgen.tree.ValueMaps;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.function.BinaryOperator;

/**
 * Settings for turning a tree into rows.
 *
 * <ul>
 *   <li>{@code minLeafDepth}: leaves are never shown shallower than this (default 2)</li>
 *   <li>{@code aggregation}: combines leaf maps into header and total values (default sum)</li>
 *   <li>{@code indentWidth}: spaces per depth level in plain text output (default 2)</li>
 *   <li>{@code policy}: header and total layout (default {@link RenderPolicy#DEFAULT})</li>
 * </ul>
 */
@Getter
@With
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RenderOptions<K> {
    public static final int DEFAULT_MIN_LEAF_DEPTH = 2;
    public static final int DEFAULT_INDENT_WIDTH = 2;

    private final int minLeafDepth;
    private final BinaryOperator<ValueMap<K>> aggregation;
    private final int indentWidth;
    private final RenderPolicy policy;

    public static <K> RenderOptions<K> defaults() {
        BinaryOperator<ValueMap<K>> sum = ValueMaps::sum;
        return new RenderOptions<K>(DEFAULT_MIN_LEAF_DEPTH, sum, DEFAULT_INDENT_WIDTH, RenderPolicy.DEFAULT);
    }
}
