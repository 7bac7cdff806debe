package com.example.demo.sheetgen.exception;

/**
 * Thrown when a tree node is neither a well formed leaf nor a well formed branch,
 * or when its value columns cannot be laid out as a table.
 */
public class MalformedTreeException extends SheetGenerationException {

    public MalformedTreeException(String description) {
        super("MALFORMED_TREE", description);
    }
}
