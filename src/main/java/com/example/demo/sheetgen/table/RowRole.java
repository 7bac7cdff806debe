package com.example.demo.sheetgen.table;

/**
 * What a rendered row stands for. Writers use it to pick row styling.
 */
public enum RowRole {
    HEADER,
    DATA,
    TOTAL
}
