package com.gridcalc.app.models;

public class TransformRequest extends RangeRequest {
    private TextTransform operation;

    public TransformRequest() {
    }

    public TransformRequest(TextTransform operation, String range) {
        super(range);
        this.operation = operation;
    }

    public TextTransform getOperation() {
        return operation;
    }
    public void setOperation(TextTransform operation) {
        this.operation = operation;
    }
}
