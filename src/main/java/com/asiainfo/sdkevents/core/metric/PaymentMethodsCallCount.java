package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 支付方式列表接口调用次数（成功的 API 调用）
 */
public class PaymentMethodsCallCount extends AbstractSdkEventMetric {

    public PaymentMethodsCallCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.PAYMENT_METHODS_CALL_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.PAYMENT_METHODS_CALL))
                .addFilterClause(LOG_TYPE, "INFO")
                .addFilterClause(CATEGORY, "API");
    }
}
