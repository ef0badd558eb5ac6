package com.gridcalc.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Settings bound from the "grid.*" keys of application.properties.
 * Defaults here match the shipped properties file, so a plain
 * {@code new GridProperties()} is usable in unit tests.
 */
@ConfigurationProperties(prefix = "grid")
public class GridProperties {

    // Size of a freshly created sheet when the request doesn't say
    private int initialRows = 20;
    private int initialColumns = 10;

    // Upper bounds for create / load / append
    private int maxRows = 1000;
    private int maxColumns = 702;

    // Deepest parenthesis/function nesting the formula parser accepts
    private int maxExpressionDepth = 256;

    // Patterns a DATE-validated cell may match (java.time syntax)
    private List<String> dateFormats = new ArrayList<>(Arrays.asList("yyyy-MM-dd", "MM/dd/yyyy", "dd.MM.yyyy"));

    public int getInitialRows() {
        return initialRows;
    }
    public void setInitialRows(int initialRows) {
        this.initialRows = initialRows;
    }

    public int getInitialColumns() {
        return initialColumns;
    }
    public void setInitialColumns(int initialColumns) {
        this.initialColumns = initialColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }
    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }
    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }

    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }
    public void setMaxExpressionDepth(int maxExpressionDepth) {
        this.maxExpressionDepth = maxExpressionDepth;
    }

    public List<String> getDateFormats() {
        return dateFormats;
    }
    public void setDateFormats(List<String> dateFormats) {
        this.dateFormats = dateFormats;
    }
}
