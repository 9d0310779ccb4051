package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;

/**
 * 无感认证（frictionless）次数（transStatus = Y）
 */
public class ThreeDsFrictionlessFlowCount extends AbstractSdkEventMetric {

    public ThreeDsFrictionlessFlowCount(UnsupportedDimensionPolicy dimensionPolicy) {
        super(SdkEventMetrics.THREE_DS_FRICTIONLESS_FLOW_COUNT, dimensionPolicy);
    }

    @Override
    protected void addEventFilters(QueryBuilder<?> queryBuilder) {
        queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.DISPLAY_THREE_DS_SDK))
                .addFilterClause(VALUE, "Y");
    }
}
