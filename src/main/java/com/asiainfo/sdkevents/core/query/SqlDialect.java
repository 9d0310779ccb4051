package com.asiainfo.sdkevents.core.query;

import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.model.AnalyticsCollection;
import com.asiainfo.sdkevents.core.model.Granularity;

import java.time.Instant;

/**
 * 后端方言：查询中间表示到原生 SQL 片段的翻译
 * 新增后端只需实现本接口 + AnalyticsDataSource，指标策略无需改动
 *
 * 1. 值翻译：时间戳、数据集名
 * 2. 聚合表达式翻译
 * 3. 窗口表达式翻译
 * 4. 时间粒度到分桶表达式的翻译
 */
public interface SqlDialect {

    String name();

    /**
     * 时间戳字面量（UTC）
     */
    String timestamp(Instant value);

    String collection(AnalyticsCollection collection);

    String aggregate(Aggregate aggregate) throws QueryBuildException;

    String window(Window window) throws QueryBuildException;

    /**
     * 将 column 截断到 granularity 对应的时间桶，结果为字符串：
     * 天粒度 yyyy-MM-dd，其余 yyyy-MM-dd HH:mm:ss
     */
    String timeBucket(Granularity granularity, String column);
}
