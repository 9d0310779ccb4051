package com.asiainfo.sdkevents.core.filter;

import com.asiainfo.sdkevents.core.datasource.AnalyticsDataSource;
import com.asiainfo.sdkevents.core.datasource.SdkEventFilterAnalytics;
import com.asiainfo.sdkevents.core.model.AnalyticsCollection;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilterRow;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.asiainfo.sdkevents.core.query.QueryBuilder;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 维度可选值查询
 * 返回租户在时间范围内某个维度出现过的全部非空取值，供前端构造过滤条件
 */
@ApplicationScoped
public class SdkEventFilterLoader {

    public <T extends AnalyticsDataSource & SdkEventFilterAnalytics> CompletableFuture<List<String>> loadFilterValues(
            SdkEventDimensions dimension,
            String publishableKey,
            TimeRange timeRange,
            T dataSource) {

        QueryBuilder<T> queryBuilder = new QueryBuilder<T>(AnalyticsCollection.SDK_EVENTS)
                .distinct()
                .addSelectColumn(dimension.getColumn())
                .addFilterClause("merchant_id", publishableKey)
                .addNotNullClause(dimension.getColumn());
        timeRange.setFilterClause(queryBuilder);

        return queryBuilder.executeQuery(dataSource, dataSource::loadFilterRow)
                .thenApply(rows -> rows.stream()
                        .map((SdkEventFilterRow row) -> row.valueOf(dimension))
                        .filter(Objects::nonNull)
                        .sorted()
                        .collect(Collectors.toList()));
    }
}
