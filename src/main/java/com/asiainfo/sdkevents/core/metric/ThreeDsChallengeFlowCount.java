package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 走 challenge 流程的 3DS 认证次数（transStatus = C）
 */
public class ThreeDsChallengeFlowCount extends AbstractSdkEventMetric {

    public ThreeDsChallengeFlowCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.THREE_DS_CHALLENGE_FLOW_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.DISPLAY_THREE_DS_SDK))
                .addFilterClause(VALUE, "C");
    }
}
