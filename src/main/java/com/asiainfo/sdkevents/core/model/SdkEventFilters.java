package com.asiainfo.sdkevents.core.model;

import com.asiainfo.sdkevents.core.query.QueryBuilder;
import com.asiainfo.sdkevents.core.query.QueryFilter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 维度过滤条件
 * 同一维度内多个值为 IN 关系，不同维度之间为 AND 关系；空列表不产生条件
 */
public record SdkEventFilters(
        @JsonProperty("payment_method") List<String> paymentMethod,
        @JsonProperty("platform") List<String> platform,
        @JsonProperty("browser_name") List<String> browserName,
        @JsonProperty("source") List<String> source,
        @JsonProperty("component") List<String> component,
        @JsonProperty("payment_experience") List<String> paymentExperience
) implements QueryFilter {

    public SdkEventFilters {
        paymentMethod = paymentMethod == null ? List.of() : List.copyOf(paymentMethod);
        platform = platform == null ? List.of() : List.copyOf(platform);
        browserName = browserName == null ? List.of() : List.copyOf(browserName);
        source = source == null ? List.of() : List.copyOf(source);
        component = component == null ? List.of() : List.copyOf(component);
        paymentExperience = paymentExperience == null ? List.of() : List.copyOf(paymentExperience);
    }

    public static SdkEventFilters empty() {
        return new SdkEventFilters(null, null, null, null, null, null);
    }

    public static SdkEventFilters of(Map<SdkEventDimensions, List<String>> values) {
        return new SdkEventFilters(
                values.get(SdkEventDimensions.PAYMENT_METHOD),
                values.get(SdkEventDimensions.PLATFORM),
                values.get(SdkEventDimensions.BROWSER_NAME),
                values.get(SdkEventDimensions.SOURCE),
                values.get(SdkEventDimensions.COMPONENT),
                values.get(SdkEventDimensions.PAYMENT_EXPERIENCE));
    }

    /**
     * 按维度枚举顺序返回（保证生成的 SQL 顺序稳定）
     */
    public Map<SdkEventDimensions, List<String>> asMap() {
        Map<SdkEventDimensions, List<String>> map = new EnumMap<>(SdkEventDimensions.class);
        map.put(SdkEventDimensions.PAYMENT_METHOD, paymentMethod);
        map.put(SdkEventDimensions.PLATFORM, platform);
        map.put(SdkEventDimensions.BROWSER_NAME, browserName);
        map.put(SdkEventDimensions.SOURCE, source);
        map.put(SdkEventDimensions.COMPONENT, component);
        map.put(SdkEventDimensions.PAYMENT_EXPERIENCE, paymentExperience);
        return map;
    }

    @Override
    public void setFilterClause(QueryBuilder<?> builder) {
        asMap().forEach((dimension, values) -> {
            if (!values.isEmpty()) {
                builder.addFilterInClause(dimension.getColumn(), values);
            }
        });
    }
}
