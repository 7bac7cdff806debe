package com.example.demo.sheetgen.table;

/**
 * Built-in ways of laying out a tree as rows.
 */
public enum RenderPolicy {
    /**
     * Header row, children, then a total row unless the only child is a leaf.
     */
    DEFAULT,
    /**
     * The header row carries the branch total; no total rows.
     */
    COMBINED_HEADER,
    /**
     * Header rows hold zero placeholders and every branch gets a total row.
     */
    COMBINED_FOOTER,
    /**
     * Header and data rows only.
     */
    HEADERS_ONLY
}
