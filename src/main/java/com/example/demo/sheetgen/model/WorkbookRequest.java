package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request for a workbook of one or more sheets, written in order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkbookRequest {
    @Builder.Default
    private List<SheetRequest> sheets = new ArrayList<>();

    /**
     * Use POI's streaming workbook. Falls back to sheetgen.excel.streaming when null.
     */
    private Boolean streaming;
}
