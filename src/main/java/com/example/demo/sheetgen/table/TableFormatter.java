package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.exception.MalformedTreeException;
import com.example.demo.sheetgen.tree.TreeNode;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;

/**
 * Plain text rendering of walked rows.
 *
 * Text output indents labels with spaces. Grid output keeps rows unindented and
 * leaves indentation to the writer, see {@code Grids}.
 */
public final class TableFormatter {
    public static final String LABEL_COLUMN = "";
    public static final String DEFAULT_EMPTY = "-";
    public static final int DEFAULT_PAD_WIDTH = 2;

    private TableFormatter() {
    }

    /**
     * Value columns of the rows: {@code first} keys, then the keys found on data
     * rows in first-seen order, then {@code last} keys. Only keys that some data
     * row carries are returned.
     */
    public static <K> List<K> columns(List<TableRow<K>> rows, List<K> first, List<K> last) {
        Set<K> seen = new LinkedHashSet<>();
        for (TableRow<K> row : rows) {
            if (row.getRole() == RowRole.DATA) {
                seen.addAll(row.getValues().keySet());
            }
        }
        List<K> out = new ArrayList<>();
        for (K k : first) {
            if (seen.contains(k) && !out.contains(k)) {
                out.add(k);
            }
        }
        for (K k : seen) {
            if (!first.contains(k) && !last.contains(k)) {
                out.add(k);
            }
        }
        for (K k : last) {
            if (seen.contains(k) && !out.contains(k)) {
                out.add(k);
            }
        }
        return out;
    }

    public static <K> List<K> columns(List<TableRow<K>> rows) {
        return columns(rows, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * One map per row, keyed by column name. The {@value #LABEL_COLUMN} column
     * holds the label indented by {@code depth * indentWidth} spaces, so no value
     * column may be named like it.
     *
     * @throws MalformedTreeException if a value column's name is the label column's
     */
    public static <K> List<Map<String, Object>> indent(List<TableRow<K>> rows, int indentWidth) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (TableRow<K> row : rows) {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put(LABEL_COLUMN, " ".repeat(row.getDepth() * indentWidth) + row.getLabel());
            for (Map.Entry<K, BigDecimal> e : row.getValues().asMap().entrySet()) {
                String column = String.valueOf(e.getKey());
                if (LABEL_COLUMN.equals(column)) {
                    throw new MalformedTreeException("Value column '" + column + "' of row '" + row.getLabel()
                            + "' clashes with the label column");
                }
                line.put(column, e.getValue());
            }
            out.add(line);
        }
        return out;
    }

    /**
     * Column aligned text with a header line of column names. Each column is as
     * wide as its widest entry plus {@code padWidth}; a row without a value for a
     * column shows {@code emptyStr}.
     */
    public static String printTable(List<Map<String, Object>> rows, List<String> columns,
                                    String emptyStr, int padWidth) {
        Map<String, Integer> widths = new LinkedHashMap<>();
        for (String column : columns) {
            int width = column.length();
            for (Map<String, Object> row : rows) {
                Object v = row.get(column);
                if (v != null) {
                    width = Math.max(width, display(v).length());
                }
            }
            widths.put(column, width + padWidth);
        }
        StringBuilder sb = new StringBuilder();
        appendLine(sb, widths, column -> column);
        for (Map<String, Object> row : rows) {
            appendLine(sb, widths, column -> row.get(column) != null ? display(row.get(column)) : emptyStr);
        }
        return sb.toString();
    }

    /**
     * Column names taken from the rows themselves, in first-seen order.
     */
    public static String printTable(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        return printTable(rows, new ArrayList<>(columns), DEFAULT_EMPTY, DEFAULT_PAD_WIDTH);
    }

    /**
     * Walk the tree with the options' policy and print it.
     */
    public static <K> String render(TreeNode<K> root, RenderOptions<K> options) {
        return render(root, options, DEFAULT_EMPTY, DEFAULT_PAD_WIDTH);
    }

    public static <K> String render(TreeNode<K> root, RenderOptions<K> options, String emptyStr, int padWidth) {
        List<TableRow<K>> rows = TreeWalker.walk(root, options);
        return print(rows, options.getIndentWidth(), emptyStr, padWidth);
    }

    public static <K> String renderForest(List<? extends TreeNode<K>> roots, RenderOptions<K> options) {
        List<TableRow<K>> rows = TreeWalker.walkForest(roots, options);
        return print(rows, options.getIndentWidth(), DEFAULT_EMPTY, DEFAULT_PAD_WIDTH);
    }

    private static <K> String print(List<TableRow<K>> rows, int indentWidth, String emptyStr, int padWidth) {
        List<String> columns = new ArrayList<>();
        columns.add(LABEL_COLUMN);
        for (K k : columns(rows)) {
            columns.add(String.valueOf(k));
        }
        return printTable(indent(rows, indentWidth), columns, emptyStr, padWidth);
    }

    private static void appendLine(StringBuilder sb, Map<String, Integer> widths,
                                   Function<String, String> cell) {
        for (Map.Entry<String, Integer> column : widths.entrySet()) {
            String text = cell.apply(column.getKey());
            sb.append(text).append(" ".repeat(Math.max(0, column.getValue() - text.length())));
        }
        sb.append('\n');
    }

    static String display(Object v) {
        if (v instanceof BigDecimal) {
            return ((BigDecimal) v).toPlainString();
        }
        return String.valueOf(v);
    }
}
