package com.example.demo.sheetgen.grid;

public enum Alignment {
    GENERAL,
    LEFT,
    CENTER,
    RIGHT
}
