package com.gridcalc.app.exceptions;

/**
 * Raised by the expression parser when a substituted formula can't be
 * evaluated (syntax error, unknown function, division by zero, text used
 * in arithmetic). Never leaves the evaluator: it is turned into #ERROR!.
 */
public class FormulaException extends RuntimeException {
    public FormulaException(String message) {
        super(message);
    }
}
