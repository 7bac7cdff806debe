package com.example.demo.sheetgen.model;

public enum SheetType {
    TREE,
    TABLE
}
