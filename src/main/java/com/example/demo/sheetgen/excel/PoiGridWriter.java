package com.example.demo.sheetgen.excel;

import com.example.demo.sheetgen.config.SheetGenProperties;
import com.example.demo.sheetgen.exception.InvalidRequestException;
import com.example.demo.sheetgen.exception.SheetGenerationException;
import com.example.demo.sheetgen.exception.WorkbookWriteException;
import com.example.demo.sheetgen.grid.Alignment;
import com.example.demo.sheetgen.grid.BorderWeight;
import com.example.demo.sheetgen.grid.Cell;
import com.example.demo.sheetgen.grid.CellStyleSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Writes grids to .xlsx workbooks with Apache POI.
 *
 * Cells are written left to right, one grid row per sheet row. A cell wider or
 * taller than one is merged over that many columns or rows and the column cursor
 * skips past it; cells under a tall cell are not skipped, so callers leave them
 * out of the following rows. Cells are styled exactly as their {@link CellStyleSpec}
 * says.
 *
 * Sheet names are cleaned and truncated to what Excel accepts and compared
 * ignoring case. In a new workbook two names that end up equal are rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoiGridWriter {
    static final String ACCOUNTING_FORMAT = "_($* #,##0.00_);_($* (#,##0.00);_($* \"-\"??_);_(@_)";
    static final String PERCENT_FORMAT = "0.00%";
    static final String YMD_FORMAT = "yyyy-MM-dd";
    static final String DEFAULT_FONT = "Arial";
    static final short DEFAULT_FONT_POINTS = 10;

    private final ExcelOutputService excelOutputService;
    private final SheetGenProperties properties;

    /**
     * Write every sheet to a new workbook and return the .xlsx bytes.
     */
    public byte[] write(Map<String, List<List<Cell>>> sheets) {
        return write(sheets, properties.getExcel().isStreaming());
    }

    public byte[] write(Map<String, List<List<Cell>>> sheets, boolean streaming) {
        Workbook workbook = streaming ? new SXSSFWorkbook() : new XSSFWorkbook();
        fill(workbook, sheets, false);
        return excelOutputService.toBytes(workbook);
    }

    /**
     * Write the sheets into a copy of an existing workbook. A sheet whose name is
     * already taken replaces the template's sheet; all other template sheets are
     * kept as they are.
     */
    public byte[] append(byte[] template, Map<String, List<List<Cell>>> sheets, boolean streaming) {
        XSSFWorkbook base;
        try {
            base = new XSSFWorkbook(new ByteArrayInputStream(template));
        } catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
            throw new WorkbookWriteException("Failed to read template workbook", e);
        }
        Workbook workbook = streaming ? new SXSSFWorkbook(base) : base;
        fill(workbook, sheets, true);
        return excelOutputService.toBytes(workbook);
    }

    /**
     * Write the workbook to a file, forcing an {@code .xlsx} extension.
     *
     * @return the path actually written
     */
    public Path writeFile(Map<String, List<List<Cell>>> sheets, Path path) {
        Path target = forceExtension(path, "xlsx");
        try (OutputStream out = Files.newOutputStream(target)) {
            writeTo(sheets, out);
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to write workbook to " + target, e);
        }
        log.info("Wrote workbook with {} sheet(s) to {}", sheets.size(), target);
        return target;
    }

    /**
     * Write to a caller owned stream, which is left open.
     */
    public void writeTo(Map<String, List<List<Cell>>> sheets, OutputStream out) {
        Workbook workbook = properties.getExcel().isStreaming() ? new SXSSFWorkbook() : new XSSFWorkbook();
        fill(workbook, sheets, false);
        excelOutputService.write(workbook, out);
    }

    /**
     * Write every sheet, or release the workbook and fail. Input POI refuses, such
     * as an over long text cell or overlapping merges, fails as an invalid request.
     */
    void fill(Workbook workbook, Map<String, List<List<Cell>>> sheets, boolean replaceExisting) {
        try {
            for (Map.Entry<String, List<List<Cell>>> entry : sheets.entrySet()) {
                writeSheet(workbook, entry.getKey(), entry.getValue(), replaceExisting);
            }
        } catch (SheetGenerationException e) {
            excelOutputService.discard(workbook);
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            excelOutputService.discard(workbook);
            throw new InvalidRequestException("Workbook rejected the sheet data: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            excelOutputService.discard(workbook);
            throw new WorkbookWriteException("Failed to fill workbook", e);
        }
    }

    /**
     * Write one grid to a new sheet. An existing sheet of the same name is replaced
     * when {@code replaceExisting} is set and rejected otherwise.
     */
    public Sheet writeSheet(Workbook workbook, String sheetName, List<List<Cell>> grid, boolean replaceExisting) {
        String safeName = WorkbookUtil.createSafeSheetName(sheetName);
        Sheet existing = workbook.getSheet(safeName);
        if (existing != null) {
            if (!replaceExisting) {
                throw new InvalidRequestException("Sheet name '" + sheetName + "' collides with sheet '"
                        + existing.getSheetName() + "'");
            }
            log.debug("Replacing existing sheet '{}'", safeName);
            workbook.removeSheetAt(workbook.getSheetIndex(existing));
        }
        Sheet sheet = workbook.createSheet(safeName);
        if (sheet instanceof SXSSFSheet) {
            ((SXSSFSheet) sheet).trackAllColumnsForAutoSizing();
        }

        StyleCache styles = new StyleCache(workbook);
        int maxColumns = 0;
        for (int r = 0; r < grid.size(); r++) {
            Row row = sheet.createRow(r);
            int col = 0;
            for (Cell cell : grid.get(r)) {
                org.apache.poi.ss.usermodel.Cell poiCell = row.createCell(col);
                int width = Math.max(1, cell.getWidth());
                int height = Math.max(1, cell.getHeight());
                if (width > 1 || height > 1) {
                    sheet.addMergedRegion(new CellRangeAddress(r, r + height - 1, col, col + width - 1));
                }
                writeValue(poiCell, cell.getValue());
                poiCell.setCellStyle(styles.get(cell.getStyle()));
                col += width;
            }
            maxColumns = Math.max(maxColumns, col);
        }

        sheet.setFitToPage(true);
        sheet.getPrintSetup().setFitWidth((short) 1);
        autoSize(sheet, grid.size(), maxColumns);
        log.debug("Wrote sheet '{}' with {} rows and {} columns", safeName, grid.size(), maxColumns);
        return sheet;
    }

    private void autoSize(Sheet sheet, int rows, int columns) {
        SheetGenProperties.Excel excel = properties.getExcel();
        if (!excel.isAutoSizeColumns()) {
            return;
        }
        if (rows >= excel.getAutoSizeRowLimit()) {
            log.debug("Skipping auto-size for sheet '{}' with {} rows", sheet.getSheetName(), rows);
            return;
        }
        for (int c = 0; c < columns; c++) {
            try {
                sheet.autoSizeColumn(c);
            } catch (RuntimeException e) {
                log.warn("Failed to auto-size column {} of sheet '{}': {}", c, sheet.getSheetName(), e.getMessage());
            }
        }
    }

    static void writeValue(org.apache.poi.ss.usermodel.Cell cell, Object value) {
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof String) {
            cell.setCellValue((String) value);
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Date) {
            cell.setCellValue((Date) value);
        } else if (value instanceof Calendar) {
            cell.setCellValue((Calendar) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
        } else if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
        } else if (value instanceof RichTextString) {
            cell.setCellValue((RichTextString) value);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    static Path forceExtension(Path path, String extension) {
        String name = path.getFileName().toString();
        if (name.endsWith("." + extension)) {
            return path;
        }
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(stem + "." + extension);
    }

    /**
     * POI caps the number of cell styles per workbook, so equal specs share one.
     */
    static final class StyleCache {
        private final Workbook workbook;
        private final Map<CellStyleSpec, CellStyle> styles = new HashMap<>();
        private final Map<String, Font> fonts = new HashMap<>();

        StyleCache(Workbook workbook) {
            this.workbook = workbook;
        }

        CellStyle get(CellStyleSpec spec) {
            return styles.computeIfAbsent(spec, this::build);
        }

        private CellStyle build(CellStyleSpec spec) {
            CellStyle style = workbook.createCellStyle();
            style.setFont(font(spec.isBold(), spec.isItalic()));
            if (spec.getIndention() > 0) {
                style.setIndention((short) spec.getIndention());
            }
            style.setAlignment(horizontal(spec.getAlignment()));
            style.setBorderTop(border(spec.getBorderTop()));
            style.setBorderBottom(border(spec.getBorderBottom()));
            if (spec.getDataFormat() != null) {
                style.setDataFormat(workbook.createDataFormat().getFormat(formatString(spec.getDataFormat())));
            }
            style.setWrapText(spec.isWrapText());
            return style;
        }

        private Font font(boolean bold, boolean italic) {
            return fonts.computeIfAbsent(bold + "/" + italic, key -> {
                Font font = workbook.createFont();
                font.setFontName(DEFAULT_FONT);
                font.setFontHeightInPoints(DEFAULT_FONT_POINTS);
                font.setBold(bold);
                font.setItalic(italic);
                return font;
            });
        }
    }

    static String formatString(String dataFormat) {
        switch (dataFormat) {
            case CellStyleSpec.ACCOUNTING:
                return ACCOUNTING_FORMAT;
            case CellStyleSpec.PERCENT:
                return PERCENT_FORMAT;
            case CellStyleSpec.YMD:
                return YMD_FORMAT;
            default:
                return dataFormat;
        }
    }

    private static HorizontalAlignment horizontal(Alignment alignment) {
        switch (alignment) {
            case LEFT:
                return HorizontalAlignment.LEFT;
            case CENTER:
                return HorizontalAlignment.CENTER;
            case RIGHT:
                return HorizontalAlignment.RIGHT;
            default:
                return HorizontalAlignment.GENERAL;
        }
    }

    private static BorderStyle border(BorderWeight weight) {
        switch (weight) {
            case THIN:
                return BorderStyle.THIN;
            case MEDIUM:
                return BorderStyle.MEDIUM;
            default:
                return BorderStyle.NONE;
        }
    }
}
