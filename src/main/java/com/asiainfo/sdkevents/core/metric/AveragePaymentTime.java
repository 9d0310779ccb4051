package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.Aggregate;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 平均支付耗时（毫秒）
 * total 为桶内 latency 平均值，count 为参与平均的事件数，供跨桶合并时加权
 */
public class AveragePaymentTime extends AbstractSdkEventMetric {

    public AveragePaymentTime(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.AVERAGE_PAYMENT_TIME, dimensionPolicy);
    }

    @Override
    protected void addAggregates(QueryBuilder<?> queryBuilder) {
        queryBuilder.addSelectColumn(Aggregate.avg(LATENCY, "total"))
                .addSelectColumn(Aggregate.count("count"));
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.PAYMENT_ATTEMPT))
                .addFilterClause(LOG_TYPE, "INFO")
                .addFilterClause(CATEGORY, "API")
                .addNotNullClause(LATENCY);
    }
}
