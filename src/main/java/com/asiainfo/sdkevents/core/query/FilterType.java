package com.asiainfo.sdkevents.core.query;

public enum FilterType {
    EQUAL("="),
    NOT_EQUAL("<>"),
    IN("IN"),
    NOT_IN("NOT IN"),
    GTE(">="),
    LT("<"),
    IS_NOT_NULL("IS NOT NULL");

    private final String operator;

    FilterType(String operator) {
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
