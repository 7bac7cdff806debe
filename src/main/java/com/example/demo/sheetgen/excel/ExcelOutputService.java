package com.example.demo.sheetgen.excel;

import com.example.demo.sheetgen.exception.WorkbookWriteException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Serializes workbooks to bytes or streams and releases them afterwards.
 */
@Slf4j
@Component
public class ExcelOutputService {

    public byte[] toBytes(Workbook workbook) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            write(workbook, baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to serialize Excel workbook", e);
        }
    }

    /**
     * Write and close the workbook. The stream stays open.
     */
    public void write(Workbook workbook, OutputStream out) {
        try (Workbook owned = workbook) {
            owned.write(out);
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to write Excel workbook", e);
        } finally {
            dispose(workbook);
        }
    }

    /**
     * Close a workbook that will not be written.
     */
    public void discard(Workbook workbook) {
        try {
            workbook.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to close discarded workbook: {}", e.getMessage());
        } finally {
            dispose(workbook);
        }
    }

    private static void dispose(Workbook workbook) {
        if (workbook instanceof SXSSFWorkbook && !((SXSSFWorkbook) workbook).dispose()) {
            log.warn("Could not delete all temporary files of a streaming workbook");
        }
    }
}
