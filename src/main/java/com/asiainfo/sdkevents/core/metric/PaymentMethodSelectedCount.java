package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

public class PaymentMethodSelectedCount extends AbstractSdkEventMetric {

    public PaymentMethodSelectedCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.PAYMENT_METHOD_SELECTED_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.PAYMENT_METHOD_CHANGED));
    }
}
