package com.asiainfo.sdkevents.core.datasource;

import com.asiainfo.sdkevents.core.model.SqlRequest;
import com.asiainfo.sdkevents.core.query.SqlDialect;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 分析后端统一接口
 * 所有后端实现必须遵循以下约定：
 * 1. execute 异步执行，失败时 future 以 QueryExecutionException 结束
 * 2. 返回的每一行以列别名为 key
 * 3. 调用方持有后端引用，核心层不缓存
 */
public interface AnalyticsDataSource {

    String getEngineName();

    SqlDialect dialect();

    CompletableFuture<List<Map<String, Object>>> execute(SqlRequest request);
}
