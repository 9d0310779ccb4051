package com.asiainfo.sdkevents.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Map;

/**
 * 查询结果
 */
@RegisterForReflection
public record SdkEventQueryResult(
        List<Map<String, Object>> dataArray, // 数据数组
        String status, // 业务状态码
        String msg
) {

    public static final String STATUS_OK = "0000";
    public static final String STATUS_ERROR = "9999";

    public static SdkEventQueryResult success(List<Map<String, Object>> dataArray, String msg) {
        return new SdkEventQueryResult(dataArray, STATUS_OK, msg);
    }

    public static SdkEventQueryResult error(String errorMsg) {
        return new SdkEventQueryResult(List.of(), STATUS_ERROR, errorMsg);
    }
}
