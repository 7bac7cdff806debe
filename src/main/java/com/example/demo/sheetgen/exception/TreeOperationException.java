package com.example.demo.sheetgen.exception;

import lombok.Getter;

/**
 * Wraps a failure raised by a caller supplied function (a renderer or an
 * aggregation operator) with the node that triggered it.
 */
@Getter
public class TreeOperationException extends SheetGenerationException {
    private final String operation;
    private final String label;
    private final int depth;

    public TreeOperationException(String operation, String label, int depth, Throwable cause) {
        super("TREE_OPERATION_FAILED",
                String.format("%s failed at node '%s' (depth %d): %s", operation, label, depth, cause.getMessage()),
                cause);
        this.operation = operation;
        this.label = label;
        this.depth = depth;
    }
}
