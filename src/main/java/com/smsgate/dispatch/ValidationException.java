package com.smsgate.dispatch;

public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String reason) {
        super(field + " " + reason);
        this.field = field;
    }

    public String getField() { return field; }
}
