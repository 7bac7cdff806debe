package com.example.demo.sheetgen.model;

import com.example.demo.sheetgen.grid.CellStyleSpec;
import com.example.demo.sheetgen.table.RenderPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One sheet of a workbook request: either a tree or a table of records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SheetRequest {
    /**
     * Sheet name. Defaults to "Sheet" plus the sheet's position.
     */
    private String name;

    @Builder.Default
    private SheetType type = SheetType.TREE;

    /**
     * For trees, replaces the root label as the sheet title. For tables, adds a
     * title row above the header.
     */
    private String title;

    /**
     * Tree in nested-map form, a single entry of root label to root node:
     *
     * { "Balance Sheet": { "Assets": { "Cash": { "2018": 100, "2017": 85 } } } }
     */
    private Map<String, Object> tree;

    /**
     * Records of a table sheet, one map of column name to value per row
     */
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();

    /**
     * Column order of a table sheet. Derived from the records when empty.
     */
    @Builder.Default
    private List<String> headers = new ArrayList<>();

    /**
     * Tree columns to show first and last, when present
     */
    @Builder.Default
    private List<String> firstColumns = new ArrayList<>();

    @Builder.Default
    private List<String> lastColumns = new ArrayList<>();

    private RenderPolicy policy;

    private Integer minLeafDepth;

    /**
     * Format of tree value cells, a named format (accounting, percent, ymd) or an
     * Excel format string. Defaults to accounting.
     */
    private String dataFormat;

    /**
     * Tree row styles by depth, for header and data rows and for total rows.
     * Either one left out keeps the built-in styles.
     */
    private Map<Integer, CellStyleSpec> formatters;

    private Map<Integer, CellStyleSpec> totalFormatters;

    /**
     * Laid over the header cells and the data cells of a table sheet
     */
    private CellStyleSpec headerStyle;

    private CellStyleSpec dataStyle;
}
