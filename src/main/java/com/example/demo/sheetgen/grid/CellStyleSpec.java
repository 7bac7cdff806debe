package com.example.demo.sheetgen.grid;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A small, writer independent description of how a cell should look.
 *
 * {@code dataFormat} is either one of the named formats ({@link #ACCOUNTING},
 * {@link #PERCENT}, {@link #YMD}) or a raw Excel format string.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class CellStyleSpec {
    public static final String ACCOUNTING = "accounting";
    public static final String PERCENT = "percent";
    public static final String YMD = "ymd";

    public static final CellStyleSpec NONE = CellStyleSpec.builder().build();

    boolean bold;
    boolean italic;
    int indention;
    @Builder.Default
    Alignment alignment = Alignment.GENERAL;
    @Builder.Default
    BorderWeight borderTop = BorderWeight.NONE;
    @Builder.Default
    BorderWeight borderBottom = BorderWeight.NONE;
    String dataFormat;
    boolean wrapText;

    /**
     * This style with every attribute {@code top} sets laid over it.
     */
    public CellStyleSpec overlay(CellStyleSpec top) {
        if (top == null || top.equals(NONE)) {
            return this;
        }
        return CellStyleSpec.builder()
                .bold(bold || top.bold)
                .italic(italic || top.italic)
                .indention(top.indention != 0 ? top.indention : indention)
                .alignment(top.alignment != Alignment.GENERAL ? top.alignment : alignment)
                .borderTop(top.borderTop != BorderWeight.NONE ? top.borderTop : borderTop)
                .borderBottom(top.borderBottom != BorderWeight.NONE ? top.borderBottom : borderBottom)
                .dataFormat(top.dataFormat != null ? top.dataFormat : dataFormat)
                .wrapText(wrapText || top.wrapText)
                .build();
    }

    public static CellStyleSpec bold() {
        return CellStyleSpec.builder().bold(true).build();
    }

    public static CellStyleSpec format(String dataFormat) {
        return CellStyleSpec.builder().dataFormat(dataFormat).build();
    }

    public static CellStyleSpec aligned(Alignment alignment) {
        return CellStyleSpec.builder().alignment(alignment).build();
    }
}
