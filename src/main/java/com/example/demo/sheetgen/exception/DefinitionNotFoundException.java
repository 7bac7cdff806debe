package com.example.demo.sheetgen.exception;

/**
 * Raised when a bundled workbook definition cannot be resolved.
 */
public class DefinitionNotFoundException extends SheetGenerationException {

    public DefinitionNotFoundException(String name) {
        super("DEFINITION_NOT_FOUND", "No workbook definition named '" + name + "'");
    }
}
