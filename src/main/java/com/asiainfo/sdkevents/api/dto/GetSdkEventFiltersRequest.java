package com.asiainfo.sdkevents.api.dto;

import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 维度可选值查询请求，group_by_names 为空时返回全部维度
 */
@RegisterForReflection
public record GetSdkEventFiltersRequest(
        @JsonProperty("time_range") TimeRange timeRange,
        @JsonProperty("group_by_names") List<SdkEventDimensions> groupByNames
) {

    public GetSdkEventFiltersRequest {
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
    }
}
