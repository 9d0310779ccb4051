package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 支付尝试次数：每次支付只统计首个 PAYMENT_ATTEMPT 事件
 */
public class PaymentAttempts extends AbstractSdkEventMetric {

    public PaymentAttempts(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.PAYMENT_ATTEMPTS, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.PAYMENT_ATTEMPT))
                .addFilterClause(FIRST_EVENT, 1);
    }
}
