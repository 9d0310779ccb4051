package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 认证接口调用失败次数
 */
public class AuthenticationUnsuccessfulCount extends AbstractSdkEventMetric {

    public AuthenticationUnsuccessfulCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.AUTHENTICATION_UNSUCCESSFUL_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.AUTHENTICATION_CALL))
                .addFilterClause(LOG_TYPE, "ERROR");
    }
}
