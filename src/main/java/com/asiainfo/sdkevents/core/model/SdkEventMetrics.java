package com.asiainfo.sdkevents.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * SDK 事件指标枚举（封闭集合）
 * 每个常量在 {@code SdkEventMetricRegistry} 中对应唯一的一个策略实现，
 * 新增指标 = 新增一个常量 + 一个策略类
 */
public enum SdkEventMetrics {
    PAYMENT_ATTEMPTS("payment_attempts"),
    PAYMENT_METHODS_CALL_COUNT("payment_methods_call_count"),
    SDK_RENDERED_COUNT("sdk_rendered_count"),
    SDK_INITIATED_COUNT("sdk_initiated_count"),
    PAYMENT_METHOD_SELECTED_COUNT("payment_method_selected_count"),
    PAYMENT_DATA_FILLED_COUNT("payment_data_filled_count"),
    AVERAGE_PAYMENT_TIME("average_payment_time"),
    THREE_DS_METHOD_SKIPPED_COUNT("three_ds_method_skipped_count"),
    THREE_DS_METHOD_INVOKED_COUNT("three_ds_method_invoked_count"),
    THREE_DS_METHOD_SUCCESSFUL_COUNT("three_ds_method_successful_count"),
    THREE_DS_METHOD_UNSUCCESSFUL_COUNT("three_ds_method_unsuccessful_count"),
    THREE_DS_CHALLENGE_FLOW_COUNT("three_ds_challenge_flow_count"),
    THREE_DS_FRICTIONLESS_FLOW_COUNT("three_ds_frictionless_flow_count"),
    AUTHENTICATION_UNSUCCESSFUL_COUNT("authentication_unsuccessful_count");

    private final String name;

    SdkEventMetrics(String name) {
        this.name = name;
    }

    /**
     * 对外名称，如 payment_attempts，同时用作配置键和结果列名
     */
    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static SdkEventMetrics fromName(String name) {
        return Arrays.stream(values())
                .filter(m -> m.name.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sdk event metric: " + name));
    }
}
