package com.asiainfo.sdkevents.core.datasource;

import com.asiainfo.sdkevents.core.exception.RowParseException;
import com.asiainfo.sdkevents.core.model.SdkEventMetricRow;

import java.util.Map;

/**
 * 能把原生行加载为 {@link SdkEventMetricRow} 的后端
 */
public interface SdkEventMetricAnalytics {

    SdkEventMetricRow loadMetricRow(Map<String, Object> row) throws RowParseException;
}
