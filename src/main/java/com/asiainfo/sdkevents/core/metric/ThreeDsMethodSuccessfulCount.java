package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

public class ThreeDsMethodSuccessfulCount extends AbstractSdkEventMetric {

    public ThreeDsMethodSuccessfulCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.THREE_DS_METHOD_SUCCESSFUL_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.THREE_DS_METHOD_RESULT))
                .addFilterClause(LOG_TYPE, "INFO");
    }
}
