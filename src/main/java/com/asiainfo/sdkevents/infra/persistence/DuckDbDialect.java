package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.query.Aggregate;

import java.time.Instant;

/**
 * DuckDB 方言
 * created_at 为 TIMESTAMP（UTC，无时区），分桶使用 date_trunc / time_bucket
 */
public class DuckDbDialect extends AbstractSqlDialect {

    public static final DuckDbDialect INSTANCE = new DuckDbDialect();

    @Override
    public String name() {
        return "duckdb";
    }

    @Override
    public String timestamp(Instant value) {
        return "TIMESTAMP '" + formatTimestamp(value) + "'";
    }

    @Override
    public String timeBucket(Granularity granularity, String column) {
        switch (granularity) {
            case ONE_DAY:
                return "strftime(date_trunc('day', " + column + "), '%Y-%m-%d')";
            case ONE_HOUR:
                return "strftime(date_trunc('hour', " + column + "), '%Y-%m-%d %H:%M:%S')";
            default:
                return String.format("strftime(time_bucket(INTERVAL '%d minutes', %s), '%%Y-%%m-%%d %%H:%%M:%%S')",
                        granularity.getMinutes(), column);
        }
    }

    @Override
    protected String percentile(Aggregate.Percentile percentile) {
        return String.format("quantile_cont(%s, %s)", percentile.field(), percentile.percentile() / 100.0);
    }
}
