package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * SDK 初始化次数
 */
public class SdkInitiatedCount extends AbstractSdkEventMetric {

    public SdkInitiatedCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.SDK_INITIATED_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.ORCA_ELEMENTS_CALLED));
    }
}
