package com.example.demo.sheetgen.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application configuration for rendering and writing workbooks.
 *
 * Example application.yml:
 *
 * sheetgen:
 *   render:
 *     min-leaf-depth: 2
 *     indent-width: 2
 *     empty-cell: "-"
 *     pad-width: 2
 *   excel:
 *     streaming: true
 *     auto-size-columns: true
 *     auto-size-row-limit: 10000
 *   pdf:
 *     font-size: 9
 *     landscape: true
 *   definitions:
 *     location: classpath:workbooks/
 */
@Data
@NoArgsConstructor
@Component
@ConfigurationProperties(prefix = "sheetgen")
public class SheetGenProperties {

    private Render render = new Render();
    private Excel excel = new Excel();
    private Pdf pdf = new Pdf();
    private Definitions definitions = new Definitions();

    @Data
    @NoArgsConstructor
    public static class Render {
        /**
         * Leaves are never shown shallower than this depth
         */
        private int minLeafDepth = 2;

        /**
         * Spaces per depth level in plain text tables
         */
        private int indentWidth = 2;

        /**
         * Placeholder for a missing value in plain text tables
         */
        private String emptyCell = "-";

        private int padWidth = 2;
    }

    @Data
    @NoArgsConstructor
    public static class Excel {
        /**
         * Use POI's streaming workbook (SXSSF) unless a request says otherwise
         */
        private boolean streaming = true;

        private boolean autoSizeColumns = true;

        /**
         * Sheets with more rows than this are not auto-sized
         */
        private int autoSizeRowLimit = 10000;
    }

    @Data
    @NoArgsConstructor
    public static class Pdf {
        private float fontSize = 9f;
        private boolean landscape = true;
    }

    @Data
    @NoArgsConstructor
    public static class Definitions {
        /**
         * Where bundled workbook definitions (YAML or JSON) are looked up
         */
        private String location = "classpath:workbooks/";
    }
}
