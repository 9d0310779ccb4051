package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.model.AnalyticsCollection;
import com.asiainfo.sdkevents.core.query.Aggregate;
import com.asiainfo.sdkevents.core.query.SqlDialect;
import com.asiainfo.sdkevents.core.query.Window;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * SQLite / DuckDB 共用的翻译逻辑，差异部分（百分位、时间分桶、时间戳字面量）由子类实现
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    protected static final DateTimeFormatter TIMESTAMP_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    @Override
    public String collection(AnalyticsCollection collection) {
        return collection.getDefaultTableName();
    }

    @Override
    public String aggregate(Aggregate aggregate) {
        if (aggregate instanceof Aggregate.Count count) {
            return count.field() == null ? "COUNT(*)" : "COUNT(" + count.field() + ")";
        }
        if (aggregate instanceof Aggregate.DistinctCount distinctCount) {
            return "COUNT(DISTINCT " + distinctCount.field() + ")";
        }
        if (aggregate instanceof Aggregate.Sum sum) {
            return "SUM(" + sum.field() + ")";
        }
        if (aggregate instanceof Aggregate.Min min) {
            return "MIN(" + min.field() + ")";
        }
        if (aggregate instanceof Aggregate.Max max) {
            return "MAX(" + max.field() + ")";
        }
        if (aggregate instanceof Aggregate.Avg avg) {
            return "AVG(" + avg.field() + ")";
        }
        if (aggregate instanceof Aggregate.Percentile percentile) {
            return percentile(percentile);
        }
        throw new QueryBuildException(name() + " cannot translate aggregate " + aggregate);
    }

    @Override
    public String window(Window window) {
        String function;
        if (window instanceof Window.Sum sum) {
            function = "SUM(" + sum.field() + ")";
        } else if (window instanceof Window.RowNumber) {
            function = "ROW_NUMBER()";
        } else {
            throw new QueryBuildException(name() + " cannot translate window " + window);
        }

        StringBuilder over = new StringBuilder();
        if (!window.partitionBy().isEmpty()) {
            over.append("PARTITION BY ").append(String.join(", ", window.partitionBy()));
        }
        if (window.orderBy() != null) {
            if (over.length() > 0) {
                over.append(' ');
            }
            over.append("ORDER BY ").append(window.orderBy());
            if (window.order() != null) {
                over.append(' ').append(window.order().name());
            }
        }
        return function + " OVER (" + over + ")";
    }

    protected String formatTimestamp(Instant value) {
        return TIMESTAMP_FMT.format(value);
    }

    protected abstract String percentile(Aggregate.Percentile percentile);
}
