package com.asiainfo.sdkevents.api.dto;

import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilters;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Set;

/**
 * SDK 事件指标查询请求
 */
@RegisterForReflection
public record GetSdkEventMetricRequest(
        @JsonProperty("time_range") TimeRange timeRange,
        @JsonProperty("granularity") Granularity granularity, // 为空表示不按时间分桶
        @JsonProperty("group_by_names") List<SdkEventDimensions> groupByNames,
        @JsonProperty("filters") SdkEventFilters filters,
        @JsonProperty("metrics") Set<SdkEventMetrics> metrics
) {

    public GetSdkEventMetricRequest {
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
        filters = filters == null ? SdkEventFilters.empty() : filters;
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
