package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.config.SheetGenProperties;
import com.example.demo.sheetgen.excel.PoiGridWriter;
import com.example.demo.sheetgen.exception.InvalidRequestException;
import com.example.demo.sheetgen.exception.MalformedTreeException;
import com.example.demo.sheetgen.grid.Alignment;
import com.example.demo.sheetgen.grid.Cell;
import com.example.demo.sheetgen.grid.CellStyleSpec;
import com.example.demo.sheetgen.model.SheetRequest;
import com.example.demo.sheetgen.model.SheetType;
import com.example.demo.sheetgen.model.WorkbookRequest;
import com.example.demo.sheetgen.pdf.PdfGridWriter;
import com.example.demo.sheetgen.table.RenderOptions;
import com.example.demo.sheetgen.table.RenderPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("Workbook composer")
public class WorkbookComposerTest {

    private WorkbookComposer composer;
    private PoiGridWriter mockPoiGridWriter;
    private PdfGridWriter mockPdfGridWriter;
    private WorkbookDefinitionLoader mockDefinitionLoader;
    private SheetGenProperties properties;

    @BeforeEach
    public void setup() {
        mockPoiGridWriter = mock(PoiGridWriter.class);
        mockPdfGridWriter = mock(PdfGridWriter.class);
        mockDefinitionLoader = mock(WorkbookDefinitionLoader.class);
        properties = new SheetGenProperties();
        composer = new WorkbookComposer(mockPoiGridWriter, mockPdfGridWriter, mockDefinitionLoader, properties);

        when(mockPoiGridWriter.write(anyMap(), anyBoolean())).thenReturn(new byte[]{1, 2, 3});
        when(mockPdfGridWriter.write(anyMap())).thenReturn(new byte[]{4, 5});
    }

    private static Map<String, Object> currentAssetsTree() {
        Map<String, Object> cash = new LinkedHashMap<>();
        cash.put("2018", 100);
        cash.put("2017", 85);
        Map<String, Object> receivable = new LinkedHashMap<>();
        receivable.put("2018", 5);
        receivable.put("2017", 45);
        Map<String, Object> currentAssets = new LinkedHashMap<>();
        currentAssets.put("Cash", cash);
        currentAssets.put("Accounts Receivable", receivable);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("Current Assets", currentAssets);
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("Balance", root);
        return tree;
    }

    private static SheetRequest treeSheet(String name) {
        return SheetRequest.builder().name(name).tree(currentAssetsTree()).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testGenerateExcelPassesSheetsInOrder() {
        WorkbookRequest request = WorkbookRequest.builder()
                .sheets(List.of(treeSheet("First"), treeSheet("Second")))
                .build();

        byte[] result = composer.generateExcel(request);

        assertArrayEquals(new byte[]{1, 2, 3}, result);
        ArgumentCaptor<Map<String, List<List<Cell>>>> captor = ArgumentCaptor.forClass(Map.class);
        verify(mockPoiGridWriter).write(captor.capture(), eq(true));
        assertEquals(List.of("First", "Second"), new ArrayList<>(captor.getValue().keySet()));
        assertEquals("Balance", captor.getValue().get("First").get(0).get(0).getValue());
    }

    @Test
    public void testRequestStreamingFlagOverridesProperties() {
        WorkbookRequest request = WorkbookRequest.builder()
                .sheets(List.of(treeSheet("Only")))
                .streaming(false)
                .build();

        composer.generateExcel(request);

        verify(mockPoiGridWriter).write(anyMap(), eq(false));
    }

    @Test
    public void testGeneratePdfUsesPdfWriter() {
        byte[] result = composer.generatePdf(WorkbookRequest.builder().sheets(List.of(treeSheet("Only"))).build());

        assertArrayEquals(new byte[]{4, 5}, result);
        verify(mockPdfGridWriter).write(anyMap());
        verifyNoInteractions(mockPoiGridWriter);
    }

    @Test
    public void testSampleExcelLoadsDefinition() {
        when(mockDefinitionLoader.load("balance-sheet"))
                .thenReturn(WorkbookRequest.builder().sheets(List.of(treeSheet("Loaded"))).build());

        composer.generateSampleExcel("balance-sheet");

        verify(mockDefinitionLoader).load("balance-sheet");
        verify(mockPoiGridWriter).write(anyMap(), anyBoolean());
    }

    @Test
    public void testUnnamedSheetsAreNumbered() {
        WorkbookRequest request = WorkbookRequest.builder()
                .sheets(List.of(treeSheet(null), treeSheet(" ")))
                .build();

        assertEquals(List.of("Sheet1", "Sheet2"), new ArrayList<>(composer.buildSheets(request).keySet()));
    }

    @Test
    public void testInvalidRequests() {
        assertThrows(InvalidRequestException.class, () -> composer.buildSheets(new WorkbookRequest()));
        assertThrows(InvalidRequestException.class, () -> composer.buildSheets(
                WorkbookRequest.builder().sheets(List.of(treeSheet("Same"), treeSheet("Same"))).build()));
        assertThrows(InvalidRequestException.class, () -> composer.buildSheets(
                WorkbookRequest.builder().sheets(List.of(SheetRequest.builder().name("Empty").build())).build()));
        assertThrows(InvalidRequestException.class, () -> composer.buildSheets(
                WorkbookRequest.builder().sheets(List.of(SheetRequest.builder().name("NoRows").type(SheetType.TABLE).build())).build()));
        verifyNoInteractions(mockPoiGridWriter);
    }

    @Test
    public void testMalformedTreeIsReported() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("Root", Map.of("Cash", "lots"));
        SheetRequest sheet = SheetRequest.builder().name("Bad").tree(tree).build();

        assertThrows(MalformedTreeException.class,
                () -> composer.generateExcel(WorkbookRequest.builder().sheets(List.of(sheet)).build()));
    }

    @Test
    public void testTitleRelabelsTheTreeRoot() {
        SheetRequest sheet = treeSheet("Titled");
        sheet.setTitle("Statement of Position");

        List<List<Cell>> grid = composer.grid(sheet);

        assertEquals("Statement of Position", grid.get(0).get(0).getValue());
    }

    @Test
    public void testTableSheetGetsTitleRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Date", "2018-01-01");
        row.put("USD", new BigDecimal("1500.50"));
        SheetRequest sheet = SheetRequest.builder()
                .name("Returns")
                .type(SheetType.TABLE)
                .title("Monthly returns")
                .rows(List.of(row))
                .build();

        List<List<Cell>> grid = composer.grid(sheet);

        assertEquals(3, grid.size());
        assertEquals("Monthly returns", grid.get(0).get(0).getValue());
        assertEquals(2, grid.get(0).get(0).getWidth());
        assertEquals("Date", grid.get(1).get(0).getValue());
    }

    @Test
    public void testOptionsComeFromSheetThenProperties() {
        properties.getRender().setIndentWidth(4);
        SheetRequest sheet = treeSheet("Opts");

        RenderOptions<String> defaults = composer.options(sheet);
        assertEquals(2, defaults.getMinLeafDepth());
        assertEquals(4, defaults.getIndentWidth());
        assertEquals(RenderPolicy.DEFAULT, defaults.getPolicy());

        sheet.setMinLeafDepth(0);
        sheet.setPolicy(RenderPolicy.COMBINED_HEADER);
        RenderOptions<String> custom = composer.options(sheet);
        assertEquals(0, custom.getMinLeafDepth());
        assertEquals(RenderPolicy.COMBINED_HEADER, custom.getPolicy());

        sheet.setMinLeafDepth(-1);
        assertThrows(InvalidRequestException.class, () -> composer.options(sheet));
    }

    @Test
    public void testRenderTreeText() {
        String text = composer.renderText(treeSheet("Text"));

        String[] lines = text.split("\n");
        assertEquals(5, lines.length);
        assertTrue(lines[0].contains("2018"));
        assertTrue(lines[2].startsWith("    Cash"));
        assertTrue(lines[4].contains("105"));
    }

    @Test
    public void testRenderTableText() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("Name", "Alice");
        first.put("Score", 9);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("Name", "Bob");
        SheetRequest sheet = SheetRequest.builder().type(SheetType.TABLE).rows(List.of(first, second)).build();

        String text = composer.renderText(sheet);

        assertEquals("Name   Score  \nAlice  9      \nBob    -      \n", text);
    }

    @Test
    @DisplayName("Sheet names that Excel treats as equal are rejected before writing")
    public void testSheetNamesCollidingIgnoringCaseAreRejected() {
        WorkbookRequest request = WorkbookRequest.builder()
                .sheets(List.of(treeSheet("Assets"), treeSheet("assets")))
                .build();

        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> composer.generateExcel(request));

        assertEquals("INVALID_REQUEST", e.getCode());
        assertTrue(e.getDescription().contains("'assets' collides with sheet 'Assets'"));
        verifyNoInteractions(mockPoiGridWriter);
    }

    @Test
    public void testSheetNamesCollidingAfterTruncationAreRejected() {
        String prefix = "Consolidated Statement of Cash Fl";
        WorkbookRequest request = WorkbookRequest.builder()
                .sheets(List.of(treeSheet(prefix + "ows A"), treeSheet(prefix + "ows B")))
                .build();

        assertThrows(InvalidRequestException.class, () -> composer.buildSheets(request));
    }

    @Test
    public void testDistinctSheetNamesSharingAShortPrefixAreKept() {
        WorkbookRequest request = WorkbookRequest.builder()
                .sheets(List.of(treeSheet("Assets 2018"), treeSheet("Assets 2017")))
                .build();

        assertEquals(2, composer.buildSheets(request).size());
    }

    @Test
    @DisplayName("Custom row formatters and data format reach the tree grid")
    public void testTreeSheetStylesComeFromRequest() {
        SheetRequest sheet = treeSheet("Styled");
        sheet.setDataFormat("0.0");
        sheet.setFormatters(Map.of(0, CellStyleSpec.builder().italic(true).build()));

        List<List<Cell>> grid = composer.grid(sheet);

        Cell currentAssets = grid.get(2).get(0);
        assertEquals("Current Assets", currentAssets.getValue());
        assertTrue(currentAssets.getStyle().isItalic());
        assertFalse(currentAssets.getStyle().isBold());
        Cell cash = grid.get(3).get(1);
        assertEquals("0.0", cash.getStyle().getDataFormat());
        assertTrue(cash.getStyle().isItalic());

        Cell total = grid.get(5).get(1);
        assertTrue(total.getStyle().isBold());
        assertEquals("0.0", total.getStyle().getDataFormat());
    }

    @Test
    public void testTableSheetStylesComeFromRequest() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Name", "Alice");
        SheetRequest sheet = SheetRequest.builder()
                .type(SheetType.TABLE)
                .rows(List.of(row))
                .headerStyle(CellStyleSpec.aligned(Alignment.CENTER))
                .dataStyle(CellStyleSpec.builder().italic(true).build())
                .build();

        List<List<Cell>> grid = composer.grid(sheet);

        assertEquals(Alignment.CENTER, grid.get(0).get(0).getStyle().getAlignment());
        assertTrue(grid.get(0).get(0).getStyle().isBold());
        assertTrue(grid.get(1).get(0).getStyle().isItalic());
    }
}
