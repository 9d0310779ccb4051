package com.asiainfo.sdkevents.core.filter;

import com.asiainfo.sdkevents.SdkEventsTestDatabase;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.asiainfo.sdkevents.infra.persistence.SqliteAnalyticsDataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SdkEventFilterLoaderTest {

    private static final TimeRange RANGE = new TimeRange(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"));

    @TempDir
    Path tempDir;

    @Test
    void testDistinctSortedValuesForTenant() throws Exception {
        SdkEventsTestDatabase db = SdkEventsTestDatabase.create(tempDir);
        db.event("pk_1", SdkEventNames.APP_RENDERED, "2024-01-01 01:00:00").platform("web").insert();
        db.event("pk_1", SdkEventNames.APP_RENDERED, "2024-01-01 02:00:00").platform("android").insert();
        db.event("pk_1", SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 03:00:00").platform("web").insert();
        db.event("pk_1", SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 04:00:00").insert();
        db.event("pk_1", SdkEventNames.PAYMENT_ATTEMPT, "2024-01-05 04:00:00").platform("ios").insert();
        db.event("pk_2", SdkEventNames.APP_RENDERED, "2024-01-01 01:00:00").platform("windows").insert();
        SqliteAnalyticsDataSource dataSource = db.analyticsDataSource();

        List<String> values = new SdkEventFilterLoader()
                .loadFilterValues(SdkEventDimensions.PLATFORM, "pk_1", RANGE, dataSource)
                .join();

        assertEquals(List.of("android", "web"), values);
    }

    @Test
    void testNoValues() throws Exception {
        SqliteAnalyticsDataSource dataSource = SdkEventsTestDatabase.create(tempDir).analyticsDataSource();

        assertTrue(new SdkEventFilterLoader()
                .loadFilterValues(SdkEventDimensions.BROWSER_NAME, "pk_1", RANGE, dataSource)
                .join()
                .isEmpty());
    }
}
