package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 3DS method 被跳过的次数
 */
public class ThreeDsMethodSkippedCount extends AbstractSdkEventMetric {

    public ThreeDsMethodSkippedCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.THREE_DS_METHOD_SKIPPED_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.THREE_DS_METHOD))
                .addFilterClause(VALUE, "Skipped");
    }
}
