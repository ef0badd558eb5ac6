package com.gridcalc.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps the service's exceptions to ErrorResponse JSON with a 4xx code.
 * Anything unexpected still becomes a 500 with SERVER_ERROR.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex) {
        return reject("INVALID_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidTypeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidType(InvalidTypeException ex) {
        return reject("INVALID_TYPE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOperation(InvalidOperationException ex) {
        return reject("INVALID_OPERATION", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        // Jackson wraps InvalidTypeException thrown from @JsonCreator factories
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof InvalidTypeException) {
            return reject("INVALID_TYPE", (InvalidTypeException) cause, HttpStatus.BAD_REQUEST);
        }
        return reject("MALFORMED_REQUEST", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CellOutOfBoundsException.class)
    public ResponseEntity<ErrorResponse> handleCellOutOfBounds(CellOutOfBoundsException ex) {
        return reject("CELL_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return reject("SHEET_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> reject(String code, Exception ex, HttpStatus status) {
        log.warn("Rejected request ({}): {}", code, ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(code, ex.getMessage()), status);
    }
}
