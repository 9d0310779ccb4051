package com.asiainfo.sdkevents.core.model;

import com.asiainfo.sdkevents.core.query.FilterType;
import com.asiainfo.sdkevents.core.query.QueryBuilder;
import com.asiainfo.sdkevents.core.query.QueryFilter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * 查询时间范围，左闭右开 [startTime, endTime)
 * startTime < endTime 由调用方保证
 */
public record TimeRange(
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime
) implements QueryFilter {

    public static final String CREATED_AT = "created_at";

    public TimeRange {
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
    }

    @Override
    public void setFilterClause(QueryBuilder<?> builder) {
        builder.addTimestampFilterClause(CREATED_AT, startTime, FilterType.GTE)
                .addTimestampFilterClause(CREATED_AT, endTime, FilterType.LT);
    }
}
