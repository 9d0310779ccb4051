package com.asiainfo.sdkevents.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 维度取值查询的结果行，每行只有被查询的那个维度列有值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SdkEventFilterRow(
        @JsonProperty("payment_method") String paymentMethod,
        @JsonProperty("platform") String platform,
        @JsonProperty("browser_name") String browserName,
        @JsonProperty("source") String source,
        @JsonProperty("component") String component,
        @JsonProperty("payment_experience") String paymentExperience
) {

    public String valueOf(SdkEventDimensions dimension) {
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
}
