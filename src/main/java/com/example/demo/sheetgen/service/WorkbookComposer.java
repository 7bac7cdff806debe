package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.config.SheetGenProperties;
import com.example.demo.sheetgen.excel.PoiGridWriter;
import com.example.demo.sheetgen.exception.InvalidRequestException;
import com.example.demo.sheetgen.grid.Cell;
import com.example.demo.sheetgen.grid.Grids;
import com.example.demo.sheetgen.grid.TreeRowStyles;
import com.example.demo.sheetgen.model.SheetRequest;
import com.example.demo.sheetgen.model.SheetType;
import com.example.demo.sheetgen.model.WorkbookRequest;
import com.example.demo.sheetgen.pdf.PdfGridWriter;
import com.example.demo.sheetgen.table.RenderOptions;
import com.example.demo.sheetgen.table.RenderPolicy;
import com.example.demo.sheetgen.table.TableFormatter;
import com.example.demo.sheetgen.tree.TreeJson;
import com.example.demo.sheetgen.tree.TreeNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.util.WorkbookUtil;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Turns workbook requests into grids and hands them to the Excel or PDF writer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkbookComposer {
    private final PoiGridWriter poiGridWriter;
    private final PdfGridWriter pdfGridWriter;
    private final WorkbookDefinitionLoader definitionLoader;
    private final SheetGenProperties properties;

    public byte[] generateExcel(WorkbookRequest request) {
        Map<String, List<List<Cell>>> sheets = buildSheets(request);
        boolean streaming = request.getStreaming() != null
                ? request.getStreaming()
                : properties.getExcel().isStreaming();
        byte[] xlsx = poiGridWriter.write(sheets, streaming);
        log.info("Excel generation complete. Sheets: {}, size: {} bytes", sheets.size(), xlsx.length);
        return xlsx;
    }

    public byte[] generatePdf(WorkbookRequest request) {
        Map<String, List<List<Cell>>> sheets = buildSheets(request);
        byte[] pdf = pdfGridWriter.write(sheets);
        log.info("PDF generation complete. Sheets: {}, size: {} bytes", sheets.size(), pdf.length);
        return pdf;
    }

    /**
     * Render a bundled workbook definition to .xlsx.
     */
    public byte[] generateSampleExcel(String name) {
        return generateExcel(definitionLoader.load(name));
    }

    /**
     * Column aligned plain text for one sheet.
     */
    public String renderText(SheetRequest sheet) {
        SheetGenProperties.Render render = properties.getRender();
        if (sheet.getType() == SheetType.TABLE) {
            List<Map<String, Object>> rows = requireRows(sheet);
            List<String> columns = sheet.getHeaders();
            if (columns == null || columns.isEmpty()) {
                Set<String> seen = new LinkedHashSet<>();
                rows.forEach(row -> seen.addAll(row.keySet()));
                columns = new ArrayList<>(seen);
            }
            return TableFormatter.printTable(rows, columns, render.getEmptyCell(), render.getPadWidth());
        }
        return TableFormatter.render(tree(sheet), options(sheet), render.getEmptyCell(), render.getPadWidth());
    }

    /**
     * One grid per sheet, keyed by sheet name in request order. Names are compared
     * the way Excel does, after cleaning and truncation and ignoring case.
     */
    public Map<String, List<List<Cell>>> buildSheets(WorkbookRequest request) {
        if (request == null || request.getSheets() == null || request.getSheets().isEmpty()) {
            throw new InvalidRequestException("A workbook needs at least one sheet");
        }
        Map<String, List<List<Cell>>> sheets = new LinkedHashMap<>();
        Map<String, String> taken = new HashMap<>();
        for (int i = 0; i < request.getSheets().size(); i++) {
            SheetRequest sheet = request.getSheets().get(i);
            if (sheet == null) {
                throw new InvalidRequestException("Sheet " + (i + 1) + " is empty");
            }
            String name = sheet.getName() != null && !sheet.getName().isBlank() ? sheet.getName() : "Sheet" + (i + 1);
            String previous = taken.putIfAbsent(WorkbookUtil.createSafeSheetName(name).toLowerCase(Locale.ROOT), name);
            if (previous != null) {
                throw new InvalidRequestException(previous.equals(name)
                        ? "Duplicate sheet name '" + name + "'"
                        : "Sheet name '" + name + "' collides with sheet '" + previous + "'");
            }
            log.debug("Building sheet '{}' of type {}", name, sheet.getType());
            sheets.put(name, grid(sheet));
        }
        return sheets;
    }

    List<List<Cell>> grid(SheetRequest sheet) {
        if (sheet.getType() == SheetType.TABLE) {
            List<List<Cell>> grid = Grids.table(requireRows(sheet), sheet.getHeaders(),
                    sheet.getHeaderStyle(), sheet.getDataStyle());
            return sheet.getTitle() != null ? Grids.withTitle(grid, sheet.getTitle()) : grid;
        }
        return Grids.tree(tree(sheet), options(sheet),
                nonNull(sheet.getFirstColumns()), nonNull(sheet.getLastColumns()),
                TreeRowStyles.of(sheet.getFormatters(), sheet.getTotalFormatters()), sheet.getDataFormat());
    }

    private TreeNode<String> tree(SheetRequest sheet) {
        if (sheet.getTree() == null) {
            throw new InvalidRequestException("Tree sheet '" + sheet.getName() + "' has no tree");
        }
        TreeNode<String> root = TreeJson.fromMap(sheet.getTree());
        return sheet.getTitle() != null ? root.withLabel(sheet.getTitle()) : root;
    }

    private List<Map<String, Object>> requireRows(SheetRequest sheet) {
        if (sheet.getRows() == null || sheet.getRows().isEmpty()) {
            throw new InvalidRequestException("Table sheet '" + sheet.getName() + "' has no rows");
        }
        return sheet.getRows();
    }

    RenderOptions<String> options(SheetRequest sheet) {
        SheetGenProperties.Render render = properties.getRender();
        int minLeafDepth = sheet.getMinLeafDepth() != null ? sheet.getMinLeafDepth() : render.getMinLeafDepth();
        if (minLeafDepth < 0) {
            throw new InvalidRequestException("minLeafDepth must not be negative, got " + minLeafDepth);
        }
        return RenderOptions.<String>defaults()
                .withMinLeafDepth(minLeafDepth)
                .withIndentWidth(render.getIndentWidth())
                .withPolicy(sheet.getPolicy() != null ? sheet.getPolicy() : RenderPolicy.DEFAULT);
    }

    private static List<String> nonNull(List<String> columns) {
        return columns != null ? columns : Collections.emptyList();
    }
}
