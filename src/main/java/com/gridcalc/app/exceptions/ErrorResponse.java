package com.gridcalc.app.exceptions;

/**
 * Body of every 4xx/5xx answer, e.g.
 * {
 *   "code": "INVALID_REFERENCE",
 *   "message": "Malformed cell address: 1A"
 * }
 * Cell-level formula errors never end up here; they are values in the grid.
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
