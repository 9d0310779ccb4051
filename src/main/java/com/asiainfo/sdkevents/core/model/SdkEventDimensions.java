package com.asiainfo.sdkevents.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * SDK 事件分组维度
 * 维度名与 sdk_events 表的列名一致
 */
public enum SdkEventDimensions {
    PAYMENT_METHOD("payment_method"),
    PLATFORM("platform"),
    BROWSER_NAME("browser_name"),
    SOURCE("source"),
    COMPONENT("component"),
    PAYMENT_EXPERIENCE("payment_experience");

    private final String column;

    SdkEventDimensions(String column) {
        this.column = column;
    }

    @JsonValue
    public String getColumn() {
        return column;
    }

    @JsonCreator
    public static SdkEventDimensions fromColumn(String column) {
        return Arrays.stream(values())
                .filter(d -> d.column.equalsIgnoreCase(column))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sdk event dimension: " + column));
    }
}
