package com.example.demo.sheetgen.controller;

import com.example.demo.sheetgen.exception.SheetGenerationException;
import com.example.demo.sheetgen.model.SheetRequest;
import com.example.demo.sheetgen.model.WorkbookRequest;
import com.example.demo.sheetgen.service.WorkbookComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST API for workbook generation
 */
@Slf4j
@RestController
@RequestMapping("/api/workbooks")
@RequiredArgsConstructor
public class WorkbookController {
    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final WorkbookComposer workbookComposer;

    /**
     * Generate an Excel workbook (XLSX) from trees and tables
     *
     * POST /api/workbooks/excel
     * {
     *   "sheets": [
     *     {
     *       "name": "Balance Sheet",
     *       "type": "TREE",
     *       "tree": { "Balance Sheet": { "Assets": { "Cash": { "2018": 100, "2017": 85 } } } }
     *     }
     *   ]
     * }
     */
    @PostMapping("/excel")
    public ResponseEntity<?> generateExcel(@RequestBody WorkbookRequest request) {
        log.info("Received Excel generation request with {} sheet(s)", request.getSheets() == null ? 0 : request.getSheets().size());
        return respond(() -> workbookComposer.generateExcel(request), XLSX, "workbook.xlsx");
    }

    /**
     * Generate a PDF of the same grids the Excel endpoint would write
     */
    @PostMapping("/pdf")
    public ResponseEntity<?> generatePdf(@RequestBody WorkbookRequest request) {
        log.info("Received PDF generation request with {} sheet(s)", request.getSheets() == null ? 0 : request.getSheets().size());
        return respond(() -> workbookComposer.generatePdf(request), MediaType.APPLICATION_PDF, "workbook.pdf");
    }

    /**
     * Render a single sheet as a column aligned plain text table
     */
    @PostMapping("/text")
    public ResponseEntity<?> renderText(@RequestBody SheetRequest sheet) {
        log.info("Received text rendering request for sheet: {}", sheet.getName());
        try {
            String text = workbookComposer.renderText(sheet);
            return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(text);
        } catch (SheetGenerationException e) {
            return error(e);
        }
    }

    /**
     * Render one of the bundled workbook definitions, e.g. /samples/balance-sheet/excel
     */
    @GetMapping("/samples/{name}/excel")
    public ResponseEntity<?> sampleExcel(@PathVariable String name) {
        log.info("Received sample Excel request for definition: {}", name);
        return respond(() -> workbookComposer.generateSampleExcel(name), XLSX, name + ".xlsx");
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Workbook generation service is running");
    }

    private ResponseEntity<?> respond(Supplier<byte[]> generator, MediaType contentType, String filename) {
        try {
            byte[] bytes = generator.get();

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(contentType);
            headers.setContentDispositionFormData("attachment", filename);
            headers.setContentLength(bytes.length);

            return new ResponseEntity<>(bytes, headers, HttpStatus.OK);
        } catch (SheetGenerationException e) {
            return error(e);
        }
    }

    private ResponseEntity<Map<String, String>> error(SheetGenerationException e) {
        String code = e.getCode();

        Map<String, String> body = new HashMap<>();
        body.put("code", code);
        body.put("description", e.getDescription());

        if ("MALFORMED_TREE".equals(code) || "INVALID_REQUEST".equals(code)) {
            log.warn("Rejected request: {}", e.getMessage());
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        } else if ("DEFINITION_NOT_FOUND".equals(code)) {
            log.warn("Definition not found: {}", e.getDescription());
            return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
        }

        log.error("Workbook generation failed", e);
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
