package com.asiainfo.sdkevents.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * 指标查询的原始结果行
 * 字段均可为空：计数类指标不填 total，不分组的维度列为 null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SdkEventMetricRow(
        @JsonProperty("total") BigDecimal total,
        @JsonProperty("count") Long count,
        @JsonProperty("time_bucket") String timeBucket,
        @JsonProperty("payment_method") String paymentMethod,
        @JsonProperty("platform") String platform,
        @JsonProperty("browser_name") String browserName,
        @JsonProperty("source") String source,
        @JsonProperty("component") String component,
        @JsonProperty("payment_experience") String paymentExperience
) {

    public String dimensionValue(SdkEventDimensions dimension) {
        switch (dimension) {
            case PAYMENT_METHOD:
                return paymentMethod;
            case PLATFORM:
                return platform;
            case BROWSER_NAME:
                return browserName;
            case SOURCE:
                return source;
            case COMPONENT:
                return component;
            case PAYMENT_EXPERIENCE:
                return paymentExperience;
            default:
                throw new IllegalArgumentException("Unsupported dimension: " + dimension);
        }
    }

    /**
     * 已填充的维度值（未分组的维度不出现）
     */
    public Map<SdkEventDimensions, String> dimensionValues() {
        Map<SdkEventDimensions, String> values = new EnumMap<>(SdkEventDimensions.class);
        for (SdkEventDimensions dimension : SdkEventDimensions.values()) {
            String value = dimensionValue(dimension);
            if (value != null) {
                values.put(dimension, value);
            }
        }
        return values;
    }
}
