package com.sheetcalc.app.config;

import com.sheetcalc.app.engine.SheetEvaluator;
import com.sheetcalc.app.models.Sheet;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under "sheet.engine":
 * - default-rows / default-columns: extents of a page created without explicit ones
 * - parse-cache-size: distinct formulas kept parsed
 * - max-range-cells: largest range a formula may expand
 * - time-zone: zone used by TODAY/NOW/YEAR/MONTH/DAY
 */
@ConfigurationProperties(prefix = "sheet.engine")
public class EngineProperties {

    private int defaultRows = Sheet.DEFAULT_ROWS;
    private int defaultColumns = Sheet.DEFAULT_COLUMNS;
    private int parseCacheSize = SheetEvaluator.DEFAULT_PARSE_CACHE_SIZE;
    private long maxRangeCells = SheetEvaluator.DEFAULT_MAX_RANGE_CELLS;
    private String timeZone = "UTC";

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultColumns() {
        return defaultColumns;
    }

    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }

    public int getParseCacheSize() {
        return parseCacheSize;
    }

    public void setParseCacheSize(int parseCacheSize) {
        this.parseCacheSize = parseCacheSize;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }
}
