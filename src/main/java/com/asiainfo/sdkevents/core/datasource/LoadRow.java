package com.asiainfo.sdkevents.core.datasource;

import com.asiainfo.sdkevents.core.exception.RowParseException;

import java.util.Map;

@FunctionalInterface
public interface LoadRow<R> {

    R load(Map<String, Object> row) throws RowParseException;
}
