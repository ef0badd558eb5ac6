package com.gridcalc.app.models;

/**
 * One cell as seen by a client: raw text, evaluated value
 * and validation state side by side.
 */
public class CellView {
    private final String address;
    private final String raw;
    private final Object value;
    private final ValidationType validation;
    private final boolean validationError;

    public CellView(String address, String raw, Object value, ValidationType validation, boolean validationError) {
        this.address = address;
        this.raw = raw;
        this.value = value;
        this.validation = validation;
        this.validationError = validationError;
    }

    public String getAddress() {
        return address;
    }
    public String getRaw() {
        return raw;
    }
    public Object getValue() {
        return value;
    }
    public ValidationType getValidation() {
        return validation;
    }
    public boolean isValidationError() {
        return validationError;
    }
}
