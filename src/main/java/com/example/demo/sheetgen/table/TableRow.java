package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.tree.ValueMap;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One line of a rendered tree: an indentation depth, a label, the row's role and
 * its values keyed by column.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TableRow<K> {
    private final int depth;
    private final String label;
    private final RowRole role;
    private final ValueMap<K> values;

    public static <K> TableRow<K> header(String label, int depth) {
        return new TableRow<>(depth, label, RowRole.HEADER, ValueMap.empty());
    }

    public static <K> TableRow<K> header(String label, int depth, ValueMap<K> values) {
        return new TableRow<>(depth, label, RowRole.HEADER, values);
    }

    public static <K> TableRow<K> data(String label, int depth, ValueMap<K> values) {
        return new TableRow<>(depth, label, RowRole.DATA, values);
    }

    /**
     * A subtotal line. Total rows have a blank label.
     */
    public static <K> TableRow<K> total(int depth, ValueMap<K> values) {
        return new TableRow<>(depth, "", RowRole.TOTAL, values);
    }
}
