package com.example.demo.sheetgen.grid;

import com.example.demo.sheetgen.table.RowRole;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Depth based styling for rows of a rendered tree.
 *
 * Header and data rows look up {@code formatters} by depth, total rows look up
 * {@code totalFormatters}. A depth past the deepest entry uses the deepest entry.
 */
public class TreeRowStyles {

    public static final TreeRowStyles DEFAULT = new TreeRowStyles(defaultFormatters(), defaultTotalFormatters());

    private final NavigableMap<Integer, CellStyleSpec> formatters;
    private final NavigableMap<Integer, CellStyleSpec> totalFormatters;

    public TreeRowStyles(Map<Integer, CellStyleSpec> formatters, Map<Integer, CellStyleSpec> totalFormatters) {
        this.formatters = new TreeMap<>(formatters);
        this.totalFormatters = new TreeMap<>(totalFormatters);
    }

    /**
     * Styles with either table replaced; a null table keeps the default one.
     */
    public static TreeRowStyles of(Map<Integer, CellStyleSpec> formatters, Map<Integer, CellStyleSpec> totalFormatters) {
        if (formatters == null && totalFormatters == null) {
            return DEFAULT;
        }
        return new TreeRowStyles(formatters != null ? formatters : defaultFormatters(),
                totalFormatters != null ? totalFormatters : defaultTotalFormatters());
    }

    public CellStyleSpec forRow(RowRole role, int depth) {
        NavigableMap<Integer, CellStyleSpec> table = role == RowRole.TOTAL ? totalFormatters : formatters;
        if (table.isEmpty()) {
            return CellStyleSpec.NONE;
        }
        CellStyleSpec exact = table.get(depth);
        return exact != null ? exact : table.lastEntry().getValue();
    }

    static Map<Integer, CellStyleSpec> defaultFormatters() {
        return Map.of(
                0, CellStyleSpec.builder().bold(true).borderBottom(BorderWeight.MEDIUM).build(),
                1, CellStyleSpec.bold(),
                2, CellStyleSpec.builder().indention(2).build(),
                3, CellStyleSpec.builder().italic(true).alignment(Alignment.RIGHT).build());
    }

    static Map<Integer, CellStyleSpec> defaultTotalFormatters() {
        return Map.of(
                0, CellStyleSpec.builder().bold(true).borderTop(BorderWeight.MEDIUM).build(),
                1, CellStyleSpec.builder().borderTop(BorderWeight.THIN).borderBottom(BorderWeight.THIN).build());
    }
}
