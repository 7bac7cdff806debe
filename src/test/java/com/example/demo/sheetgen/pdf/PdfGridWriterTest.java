package com.example.demo.sheetgen.pdf;

import com.example.demo.sheetgen.config.SheetGenProperties;
import com.example.demo.sheetgen.grid.Cell;
import com.example.demo.sheetgen.grid.CellStyleSpec;
import com.example.demo.sheetgen.grid.Grids;
import com.example.demo.sheetgen.table.RenderOptions;
import com.example.demo.sheetgen.tree.BalanceSheetFixture;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PdfGridWriterTest {

    private SheetGenProperties properties;
    private PdfGridWriter writer;

    @BeforeEach
    public void setup() {
        properties = new SheetGenProperties();
        writer = new PdfGridWriter(properties);
    }

    @Test
    public void testBalanceSheetText() throws Exception {
        Map<String, List<List<Cell>>> sheets = new LinkedHashMap<>();
        sheets.put("Balance Sheet", Grids.tree(BalanceSheetFixture.balanceSheet(), RenderOptions.defaults()));

        byte[] pdf = writer.write(sheets);

        try (PDDocument document = PDDocument.load(pdf)) {
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("Balance Sheet"));
            assertTrue(text.contains("Mock Balance Sheet"));
            assertTrue(text.contains("Accounts Receivable"));
            assertTrue(text.contains("217.00"));
            PDRectangle box = document.getPage(0).getMediaBox();
            assertTrue(box.getWidth() > box.getHeight());
        }
    }

    @Test
    public void testEachSheetStartsANewPage() throws Exception {
        Map<String, List<List<Cell>>> sheets = new LinkedHashMap<>();
        sheets.put("First", List.of(List.of(Cell.of("one"))));
        sheets.put("Second", List.of(List.of(Cell.of("two"))));

        try (PDDocument document = PDDocument.load(writer.write(sheets))) {
            assertEquals(2, document.getNumberOfPages());
        }
    }

    @Test
    public void testLongSheetsOverflowOntoMorePages() throws Exception {
        List<List<Cell>> grid = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            grid.add(List.of(Cell.of("row " + i), Cell.of(i)));
        }
        properties.getPdf().setLandscape(false);

        try (PDDocument document = PDDocument.load(writer.write(Map.of("Long", grid)))) {
            assertTrue(document.getNumberOfPages() > 1);
            PDRectangle box = document.getPage(0).getMediaBox();
            assertTrue(box.getWidth() < box.getHeight());
        }
    }

    @Test
    public void testEmptyWorkbookIsOneBlankPage() throws Exception {
        try (PDDocument document = PDDocument.load(writer.write(Map.of()))) {
            assertEquals(1, document.getNumberOfPages());
        }
    }

    @Test
    public void testCellText() {
        CellStyleSpec accounting = CellStyleSpec.format(CellStyleSpec.ACCOUNTING);

        assertEquals("1,234.50", PdfGridWriter.text(new BigDecimal("1234.5"), accounting));
        assertEquals("(1,234.50)", PdfGridWriter.text(new BigDecimal("-1234.5"), accounting));
        assertEquals("12.50%", PdfGridWriter.text(new BigDecimal("0.125"), CellStyleSpec.format(CellStyleSpec.PERCENT)));
        assertEquals("42", PdfGridWriter.text(42, CellStyleSpec.NONE));
        assertEquals("2018-12-31", PdfGridWriter.text(LocalDate.of(2018, 12, 31), CellStyleSpec.NONE));
        assertEquals("", PdfGridWriter.text(null, CellStyleSpec.NONE));
    }

    @Test
    public void testUnencodableCharactersAreReplaced() {
        assertEquals("a?b", PdfGridWriter.encodable(PDType1Font.HELVETICA, "a日b"));
        assertEquals("plain", PdfGridWriter.encodable(PDType1Font.HELVETICA, "plain"));
    }
}
