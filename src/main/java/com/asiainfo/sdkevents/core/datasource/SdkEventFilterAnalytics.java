package com.asiainfo.sdkevents.core.datasource;

import com.asiainfo.sdkevents.core.exception.RowParseException;
import com.asiainfo.sdkevents.core.model.SdkEventFilterRow;

import java.util.Map;

public interface SdkEventFilterAnalytics {

    SdkEventFilterRow loadFilterRow(Map<String, Object> row) throws RowParseException;
}
