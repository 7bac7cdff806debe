package com.example.demo.sheetgen.grid;

import com.example.demo.sheetgen.table.RowRole;
import lombok.Builder;
import lombok.Value;

/**
 * One grid cell: a value plus optional display metadata.
 *
 * Values may be strings, numbers, booleans or dates. {@code width} and
 * {@code height} greater than one make the cell span that many columns or rows.
 * {@code depth} and {@code role} are hints from a rendered tree; writers decide
 * what they look like.
 */
@Value
@Builder(toBuilder = true)
public class Cell {
    Object value;
    @Builder.Default
    CellStyleSpec style = CellStyleSpec.NONE;
    @Builder.Default
    int width = 1;
    @Builder.Default
    int height = 1;
    Integer depth;
    RowRole role;

    public static Cell of(Object value) {
        return Cell.builder().value(value).build();
    }

    public static Cell of(Object value, CellStyleSpec style) {
        return Cell.builder().value(value).style(style).build();
    }
}
