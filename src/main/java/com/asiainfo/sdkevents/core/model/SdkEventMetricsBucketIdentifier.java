package com.asiainfo.sdkevents.core.model;

import com.asiainfo.sdkevents.core.exception.RowParseException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 结果桶标识 = 时间桶 + 维度取值组合
 * 只能由单行结果推导（{@link #fromRow}），不接受外部独立构造的时间桶
 */
public record SdkEventMetricsBucketIdentifier(
        LocalDateTime timeBucket,
        Map<SdkEventDimensions, String> dimensions
) {

    private static final DateTimeFormatter DAY_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter SECOND_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public SdkEventMetricsBucketIdentifier {
        Map<SdkEventDimensions, String> copy = new EnumMap<>(SdkEventDimensions.class);
        if (dimensions != null) {
            dimensions.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        dimensions = Collections.unmodifiableMap(copy);
    }

    public static SdkEventMetricsBucketIdentifier fromRow(SdkEventMetricRow row) {
        return new SdkEventMetricsBucketIdentifier(parseTimeBucket(row.timeBucket()), row.dimensionValues());
    }

    public String dimension(SdkEventDimensions dimension) {
        return dimensions.get(dimension);
    }

    /**
     * 天粒度为 yyyy-MM-dd，其余为 yyyy-MM-dd HH:mm:ss
     */
    static LocalDateTime parseTimeBucket(String timeBucket) {
        if (timeBucket == null || timeBucket.isBlank()) {
            return null;
        }
        try {
            if (timeBucket.length() == 10) {
                return LocalDate.parse(timeBucket, DAY_FMT).atStartOfDay();
            }
            return LocalDateTime.parse(timeBucket, SECOND_FMT);
        } catch (DateTimeParseException e) {
            throw new RowParseException("Invalid time_bucket value: " + timeBucket, e);
        }
    }
}
