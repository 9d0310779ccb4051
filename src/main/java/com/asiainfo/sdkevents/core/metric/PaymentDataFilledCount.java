package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

public class PaymentDataFilledCount extends AbstractSdkEventMetric {

    public PaymentDataFilledCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.PAYMENT_DATA_FILLED_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.PAYMENT_DATA_FILLED));
    }
}
