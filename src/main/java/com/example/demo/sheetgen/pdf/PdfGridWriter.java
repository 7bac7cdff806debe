package com.example.demo.sheetgen.pdf;

import com.example.demo.sheetgen.config.SheetGenProperties;
import com.example.demo.sheetgen.exception.WorkbookWriteException;
import com.example.demo.sheetgen.grid.Alignment;
import com.example.demo.sheetgen.grid.BorderWeight;
import com.example.demo.sheetgen.grid.Cell;
import com.example.demo.sheetgen.grid.CellStyleSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.SimpleDateFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Lays grids out as simple PDF tables, one sheet after another, each sheet
 * starting on a new page under its name.
 *
 * Columns are sized to their widest single-column cell and scaled down to fit
 * the page width. Cells are drawn in their own style and tree labels are
 * indented by depth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfGridWriter {
    private static final float MARGIN = 36f;
    private static final float CELL_PADDING = 4f;
    private static final float LINE_SPACING = 1.5f;

    private final SheetGenProperties properties;

    public byte[] write(Map<String, List<List<Cell>>> sheets) {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (Map.Entry<String, List<List<Cell>>> sheet : sheets.entrySet()) {
                new SheetLayout(document, sheet.getKey(), sheet.getValue()).render();
            }
            if (document.getNumberOfPages() == 0) {
                document.addPage(new PDPage(pageSize()));
            }
            document.save(out);
            log.debug("Wrote PDF with {} page(s) for {} sheet(s)", document.getNumberOfPages(), sheets.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to write PDF document", e);
        }
    }

    private PDRectangle pageSize() {
        PDRectangle a4 = PDRectangle.A4;
        return properties.getPdf().isLandscape() ? new PDRectangle(a4.getHeight(), a4.getWidth()) : a4;
    }

    /**
     * Text for a cell value in the cell's data format.
     */
    static String text(Object value, CellStyleSpec style) {
        if (value == null) {
            return "";
        }
        String format = style.getDataFormat();
        if (value instanceof Number) {
            BigDecimal n = value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString());
            if (CellStyleSpec.ACCOUNTING.equals(format)) {
                return new DecimalFormat("#,##0.00;(#,##0.00)", DecimalFormatSymbols.getInstance(Locale.US)).format(n);
            }
            if (CellStyleSpec.PERCENT.equals(format)) {
                return new DecimalFormat("0.00%", DecimalFormatSymbols.getInstance(Locale.US)).format(n);
            }
            return n.toPlainString();
        }
        if (value instanceof Date) {
            return new SimpleDateFormat("yyyy-MM-dd").format((Date) value);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        return value.toString();
    }

    /**
     * Replace characters the standard fonts cannot encode.
     */
    static String encodable(PDFont font, String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            try {
                font.encode(String.valueOf(c));
                sb.append(c);
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    private static PDFont font(CellStyleSpec style) {
        if (style.isBold() && style.isItalic()) {
            return PDType1Font.HELVETICA_BOLD_OBLIQUE;
        }
        if (style.isBold()) {
            return PDType1Font.HELVETICA_BOLD;
        }
        return style.isItalic() ? PDType1Font.HELVETICA_OBLIQUE : PDType1Font.HELVETICA;
    }

    private final class SheetLayout {
        private final PDDocument document;
        private final String name;
        private final List<List<Cell>> grid;
        private final float fontSize = properties.getPdf().getFontSize();
        private final float lineHeight = fontSize * LINE_SPACING;

        private PDPageContentStream stream;
        private PDRectangle page;
        private float y;
        private float[] widths;

        SheetLayout(PDDocument document, String name, List<List<Cell>> grid) {
            this.document = document;
            this.name = name;
            this.grid = grid;
        }

        void render() throws IOException {
            widths = columnWidths();
            newPage();
            try {
                writeText(PDType1Font.HELVETICA_BOLD, fontSize + 2, MARGIN, y, name);
                y -= lineHeight * 1.5f;
                for (List<Cell> row : grid) {
                    if (y < MARGIN + lineHeight) {
                        stream.close();
                        newPage();
                    }
                    writeRow(row);
                    y -= lineHeight;
                }
            } finally {
                stream.close();
            }
        }

        private void newPage() throws IOException {
            page = pageSize();
            PDPage pdPage = new PDPage(page);
            document.addPage(pdPage);
            stream = new PDPageContentStream(document, pdPage);
            y = page.getHeight() - MARGIN - lineHeight;
        }

        private void writeRow(List<Cell> row) throws IOException {
            float x = MARGIN;
            int col = 0;
            for (Cell cell : row) {
                int span = Math.max(1, cell.getWidth());
                float width = 0;
                for (int c = col; c < col + span && c < widths.length; c++) {
                    width += widths[c];
                }
                CellStyleSpec style = cell.getStyle();
                PDFont font = font(style);
                String text = encodable(font, text(cell.getValue(), style));
                float indent = cell.getDepth() != null && col == 0 ? cell.getDepth() * fontSize : 0;
                float textWidth = font.getStringWidth(text) / 1000f * fontSize;
                float textX;
                Alignment alignment = effectiveAlignment(style, cell.getValue());
                if (alignment == Alignment.RIGHT) {
                    textX = x + width - CELL_PADDING - textWidth;
                } else if (alignment == Alignment.CENTER) {
                    textX = x + (width - textWidth) / 2;
                } else {
                    textX = x + CELL_PADDING + indent + style.getIndention() * fontSize / 2;
                }
                if (!text.isEmpty()) {
                    writeText(font, fontSize, textX, y, text);
                }
                border(style.getBorderTop(), x, y + lineHeight - fontSize * 0.3f, width);
                border(style.getBorderBottom(), x, y - fontSize * 0.3f, width);
                x += width;
                col += span;
            }
        }

        private Alignment effectiveAlignment(CellStyleSpec style, Object value) {
            if (style.getAlignment() != Alignment.GENERAL) {
                return style.getAlignment();
            }
            return value instanceof Number ? Alignment.RIGHT : Alignment.LEFT;
        }

        private void border(BorderWeight weight, float x, float lineY, float width) throws IOException {
            if (weight == BorderWeight.NONE) {
                return;
            }
            stream.setLineWidth(weight == BorderWeight.MEDIUM ? 1.2f : 0.5f);
            stream.moveTo(x, lineY);
            stream.lineTo(x + width, lineY);
            stream.stroke();
        }

        private void writeText(PDFont font, float size, float x, float textY, String text) throws IOException {
            stream.beginText();
            stream.setFont(font, size);
            stream.newLineAtOffset(x, textY);
            stream.showText(encodable(font, text));
            stream.endText();
        }

        private float[] columnWidths() throws IOException {
            int columns = 0;
            for (List<Cell> row : grid) {
                int count = 0;
                for (Cell cell : row) {
                    count += Math.max(1, cell.getWidth());
                }
                columns = Math.max(columns, count);
            }
            float[] out = new float[columns];
            for (List<Cell> row : grid) {
                int col = 0;
                for (Cell cell : row) {
                    int span = Math.max(1, cell.getWidth());
                    if (span == 1) {
                        CellStyleSpec style = cell.getStyle();
                        PDFont font = font(style);
                        float indent = cell.getDepth() != null && col == 0 ? cell.getDepth() * fontSize : 0;
                        String text = encodable(font, text(cell.getValue(), style));
                        float w = font.getStringWidth(text) / 1000f * fontSize + indent + 2 * CELL_PADDING;
                        out[col] = Math.max(out[col], w);
                    }
                    col += span;
                }
            }
            float total = 0;
            for (float w : out) {
                total += w;
            }
            float available = pageSize().getWidth() - 2 * MARGIN;
            if (total > available) {
                float scale = available / total;
                for (int i = 0; i < out.length; i++) {
                    out[i] *= scale;
                }
            }
            return out;
        }
    }
}
