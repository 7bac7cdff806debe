package com.example.demo.sheetgen.grid;

import com.example.demo.sheetgen.exception.InvalidRequestException;
import com.example.demo.sheetgen.table.RenderOptions;
import com.example.demo.sheetgen.table.TableFormatter;
import com.example.demo.sheetgen.table.TableRow;
import com.example.demo.sheetgen.table.TreeWalker;
import com.example.demo.sheetgen.tree.TreeNode;

import java.math.BigDecimal;
import java.util.*;

/**
 * Builds grids ({@code List<List<Cell>>}) from trees and tables.
 */
public final class Grids {
    static final int WRAP_THRESHOLD = 75;

    private static final CellStyleSpec TREE_HEADER = CellStyleSpec.builder()
            .bold(true)
            .alignment(Alignment.RIGHT)
            .build();
    private static final CellStyleSpec TABLE_HEADER = CellStyleSpec.builder()
            .bold(true)
            .borderBottom(BorderWeight.THIN)
            .build();

    private Grids() {
    }

    /**
     * A titled grid of the walked tree.
     *
     * Row 1 is the root label, centred across the full width. Row 2 holds the
     * column headers. Each following row is one walked row: the label cell, then
     * one cell per column in {@code dataFormat}. Line cells are styled by
     * {@code styles} for their row's depth and role, and keep the depth and role
     * so the PDF writer can indent them.
     */
    public static <K> List<List<Cell>> tree(TreeNode<K> root, RenderOptions<K> options,
                                            List<K> firstColumns, List<K> lastColumns,
                                            TreeRowStyles styles, String dataFormat) {
        List<TableRow<K>> rows = TreeWalker.walk(root, options);
        List<K> columns = TableFormatter.columns(rows, firstColumns, lastColumns);

        List<List<Cell>> grid = new ArrayList<>(rows.size() + 2);
        grid.add(List.of(Cell.builder()
                .value(root.getLabel())
                .style(CellStyleSpec.aligned(Alignment.CENTER))
                .width(columns.size() + 1)
                .build()));

        List<Cell> header = new ArrayList<>(columns.size() + 1);
        header.add(Cell.of(""));
        for (K column : columns) {
            header.add(Cell.of(String.valueOf(column), TREE_HEADER));
        }
        grid.add(header);

        CellStyleSpec valueFormat = CellStyleSpec.format(dataFormat != null ? dataFormat : CellStyleSpec.ACCOUNTING);
        for (TableRow<K> row : rows) {
            CellStyleSpec rowStyle = styles.forRow(row.getRole(), row.getDepth());
            CellStyleSpec valueStyle = rowStyle.overlay(valueFormat);
            List<Cell> line = new ArrayList<>(columns.size() + 1);
            line.add(Cell.builder()
                    .value(row.getLabel())
                    .style(rowStyle)
                    .depth(row.getDepth())
                    .role(row.getRole())
                    .build());
            for (K column : columns) {
                BigDecimal v = row.getValues().containsKey(column) ? row.getValues().get(column) : null;
                line.add(Cell.builder()
                        .value(v)
                        .style(valueStyle)
                        .depth(row.getDepth())
                        .role(row.getRole())
                        .build());
            }
            grid.add(line);
        }
        return grid;
    }

    public static <K> List<List<Cell>> tree(TreeNode<K> root, RenderOptions<K> options,
                                            List<K> firstColumns, List<K> lastColumns) {
        return tree(root, options, firstColumns, lastColumns, TreeRowStyles.DEFAULT, CellStyleSpec.ACCOUNTING);
    }

    public static <K> List<List<Cell>> tree(TreeNode<K> root, RenderOptions<K> options) {
        return tree(root, options, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * A grid of tabular records, one row per record under a header row.
     *
     * Without explicit headers the columns are the record keys in first-seen
     * order. Cell formats are guessed: long strings wrap, columns named like a
     * percentage get a percent format, date columns get {@code yyyy-MM-dd} and
     * decimals get accounting format. Headers of numeric columns are right aligned.
     * {@code headerStyle} and {@code dataStyle}, when given, are laid over the
     * header cells and the guessed data cell styles.
     */
    public static List<List<Cell>> table(List<? extends Map<String, ?>> records, List<String> headers,
                                         CellStyleSpec headerStyle, CellStyleSpec dataStyle) {
        List<String> columns = headers;
        if (columns == null || columns.isEmpty()) {
            Set<String> seen = new LinkedHashSet<>();
            for (Map<String, ?> record : records) {
                seen.addAll(record.keySet());
            }
            columns = new ArrayList<>(seen);
        }
        if (columns.isEmpty()) {
            throw new InvalidRequestException("A table needs at least one column");
        }

        Set<String> numeric = new HashSet<>();
        List<List<Cell>> body = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Cell> line = new ArrayList<>(columns.size());
            for (String column : columns) {
                Object v = record.get(column);
                CellStyleSpec style = guessFormat(column, v);
                if (CellStyleSpec.ACCOUNTING.equals(style.getDataFormat()) || v instanceof Number) {
                    numeric.add(column);
                }
                line.add(Cell.of(v, style.overlay(dataStyle)));
            }
            body.add(line);
        }

        List<Cell> header = new ArrayList<>(columns.size());
        for (String column : columns) {
            CellStyleSpec style = numeric.contains(column)
                    ? TABLE_HEADER.toBuilder().alignment(Alignment.RIGHT).build()
                    : TABLE_HEADER;
            header.add(Cell.of(column, style.overlay(headerStyle)));
        }

        List<List<Cell>> grid = new ArrayList<>(body.size() + 1);
        grid.add(header);
        grid.addAll(body);
        return grid;
    }

    public static List<List<Cell>> table(List<? extends Map<String, ?>> records, List<String> headers) {
        return table(records, headers, null, null);
    }

    /**
     * The grid with a centred title row as wide as its widest row.
     */
    public static List<List<Cell>> withTitle(List<List<Cell>> grid, String title) {
        int width = 0;
        for (List<Cell> row : grid) {
            int rowWidth = 0;
            for (Cell cell : row) {
                rowWidth += Math.max(1, cell.getWidth());
            }
            width = Math.max(width, rowWidth);
        }
        List<List<Cell>> out = new ArrayList<>(grid.size() + 1);
        out.add(List.of(Cell.builder()
                .value(title)
                .style(CellStyleSpec.aligned(Alignment.CENTER))
                .width(Math.max(1, width))
                .build()));
        out.addAll(grid);
        return out;
    }

    static CellStyleSpec guessFormat(String column, Object value) {
        String name = column.toLowerCase(Locale.ROOT);
        if (value instanceof String && ((String) value).length() > WRAP_THRESHOLD) {
            return CellStyleSpec.builder().wrapText(true).build();
        }
        if (name.contains("percent") || name.contains("%")) {
            return CellStyleSpec.format(CellStyleSpec.PERCENT);
        }
        if (name.contains("date")) {
            return CellStyleSpec.builder().dataFormat(CellStyleSpec.YMD).alignment(Alignment.LEFT).build();
        }
        if (value instanceof BigDecimal) {
            return CellStyleSpec.format(CellStyleSpec.ACCOUNTING);
        }
        return CellStyleSpec.NONE;
    }
}
