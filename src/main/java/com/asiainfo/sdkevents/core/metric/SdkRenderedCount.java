package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * SDK 渲染次数
 */
public class SdkRenderedCount extends AbstractSdkEventMetric {

    public SdkRenderedCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.SDK_RENDERED_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.APP_RENDERED));
    }
}
