package com.example.demo.sheetgen.exception;

public class WorkbookWriteException extends SheetGenerationException {

    public WorkbookWriteException(String description, Throwable cause) {
        super("WORKBOOK_WRITE_FAILED", description, cause);
    }
}
