package com.asiainfo.sdkevents.core.model;

import com.asiainfo.sdkevents.core.exception.RowParseException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 桶标识推导测试
 */
class SdkEventMetricsBucketIdentifierTest {

    private static SdkEventMetricRow row(String timeBucket, String platform, String source) {
        return new SdkEventMetricRow(null, 1L, timeBucket, null, platform, null, source, null, null);
    }

    @Test
    void testDayAndSecondBuckets() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0),
                SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01", null, null)).timeBucket());
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 15),
                SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01 10:15:00", null, null)).timeBucket());
        assertNull(SdkEventMetricsBucketIdentifier.fromRow(row(null, null, null)).timeBucket());
    }

    @Test
    void testDistinctRowsGiveDistinctIdentifiers() {
        SdkEventMetricsBucketIdentifier web = SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01", "web", null));
        SdkEventMetricsBucketIdentifier ios = SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01", "ios", null));
        SdkEventMetricsBucketIdentifier nextDay =
                SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-02", "web", null));
        // 值相同但落在不同维度上
        SdkEventMetricsBucketIdentifier webAsSource =
                SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01", null, "web"));

        assertNotEquals(web, ios);
        assertNotEquals(web, nextDay);
        assertNotEquals(web, webAsSource);
    }

    @Test
    void testSameRowGivesEqualIdentifier() {
        SdkEventMetricsBucketIdentifier a = SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01", "web", "s1"));
        SdkEventMetricsBucketIdentifier b = SdkEventMetricsBucketIdentifier.fromRow(row("2024-01-01", "web", "s1"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(Map.of(SdkEventDimensions.PLATFORM, "web", SdkEventDimensions.SOURCE, "s1"), a.dimensions());
    }

    @Test
    void testMalformedTimeBucket() {
        assertThrows(RowParseException.class,
                () -> SdkEventMetricsBucketIdentifier.fromRow(row("01/01/2024", null, null)));
        assertThrows(RowParseException.class,
                () -> SdkEventMetricsBucketIdentifier.fromRow(row("2024-13-01", null, null)));
    }
}
