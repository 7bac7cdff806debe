package com.example.demo.sheetgen.exception;

import lombok.Getter;

/**
 * Base exception for sheet generation failures. Carries a stable error code
 * (used by the HTTP layer to pick a status) and a human readable description.
 */
@Getter
public class SheetGenerationException extends RuntimeException {
    private final String code;
    private final String description;

    public SheetGenerationException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public SheetGenerationException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
