package com.example.demo.sheetgen.table;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * The rows a {@link NodeRenderer} produces for one node: rows placed before the
 * node's children, rows placed after them, and whether the walk should visit the
 * children at all.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class NodeRendering<K> {
    private final List<TableRow<K>> leading;
    private final List<TableRow<K>> trailing;
    private final boolean descend;

    public static <K> NodeRendering<K> row(TableRow<K> row) {
        return new NodeRendering<>(List.of(row), Collections.emptyList(), false);
    }

    /**
     * Rows around a node's children, which will be visited in between.
     */
    public static <K> NodeRendering<K> around(List<TableRow<K>> leading, List<TableRow<K>> trailing) {
        return new NodeRendering<>(List.copyOf(leading), List.copyOf(trailing), true);
    }

    public static <K> NodeRendering<K> skip() {
        return new NodeRendering<>(Collections.emptyList(), Collections.emptyList(), false);
    }
}
