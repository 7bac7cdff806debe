package com.example.demo.sheetgen.exception;

public class InvalidRequestException extends SheetGenerationException {

    public InvalidRequestException(String description) {
        super("INVALID_REQUEST", description);
    }

    public InvalidRequestException(String description, Throwable cause) {
        super("INVALID_REQUEST", description, cause);
    }
}
