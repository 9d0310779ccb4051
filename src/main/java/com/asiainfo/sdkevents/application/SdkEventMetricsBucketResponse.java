package com.asiainfo.sdkevents.application;

import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventMetricsBucketIdentifier;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个桶的合并结果：桶标识 + 各指标取值
 */
public record SdkEventMetricsBucketResponse(
        SdkEventMetricsBucketIdentifier identifier,
        Map<SdkEventMetrics, Number> values
) {

    private static final DateTimeFormatter BUCKET_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public Number value(SdkEventMetrics metric) {
        return values.get(metric);
    }

    /**
     * 扁平化为一行输出：time_bucket、维度列、各指标名 -> 值
     */
    public Map<String, Object> toDataRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("time_bucket", identifier.timeBucket() == null ? null : BUCKET_FMT.format(identifier.timeBucket()));
        for (SdkEventDimensions dimension : SdkEventDimensions.values()) {
            String value = identifier.dimension(dimension);
            if (value != null) {
                row.put(dimension.getColumn(), value);
            }
        }
        values.forEach((metric, value) -> row.put(metric.getName(), value));
        return row;
    }
}
