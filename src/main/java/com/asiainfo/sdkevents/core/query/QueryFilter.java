package com.asiainfo.sdkevents.core.query;

/**
 * 能把自身翻译为过滤条件的请求参数（过滤器、时间范围）
 */
public interface QueryFilter {

    void setFilterClause(QueryBuilder<?> builder);
}
