package com.example.demo.sheetgen.grid;

public enum BorderWeight {
    NONE,
    THIN,
    MEDIUM
}
