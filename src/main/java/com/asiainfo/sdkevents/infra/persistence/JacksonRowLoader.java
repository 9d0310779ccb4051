package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.datasource.LoadRow;
import com.asiainfo.sdkevents.core.exception.RowParseException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * 以列别名为属性名，用 Jackson 把 JDBC 行映射为结果 record
 */
public class JacksonRowLoader<R> implements LoadRow<R> {

    private final ObjectMapper objectMapper;
    private final Class<R> rowType;

    public JacksonRowLoader(ObjectMapper objectMapper, Class<R> rowType) {
        this.objectMapper = objectMapper;
        this.rowType = rowType;
    }

    @Override
    public R load(Map<String, Object> row) {
        try {
            return objectMapper.convertValue(row, rowType);
        } catch (IllegalArgumentException e) {
            throw new RowParseException("Failed to load " + rowType.getSimpleName() + " from row " + row, e);
        }
    }
}
