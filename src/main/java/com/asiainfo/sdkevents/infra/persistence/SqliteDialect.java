package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.query.Aggregate;

import java.time.Instant;

/**
 * SQLite 方言
 * created_at 以 'yyyy-MM-dd HH:mm:ss'（UTC）文本存储，字典序即时间序
 */
public class SqliteDialect extends AbstractSqlDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public String timestamp(Instant value) {
        return "'" + formatTimestamp(value) + "'";
    }

    @Override
    public String timeBucket(Granularity granularity, String column) {
        switch (granularity) {
            case ONE_DAY:
                return "strftime('%Y-%m-%d', " + column + ")";
            case ONE_HOUR:
                return "strftime('%Y-%m-%d %H:00:00', " + column + ")";
            default:
                long seconds = granularity.getSeconds();
                return String.format(
                        "strftime('%%Y-%%m-%%d %%H:%%M:%%S', (CAST(strftime('%%s', %s) AS INTEGER) / %d) * %d, 'unixepoch')",
                        column, seconds, seconds);
        }
    }

    @Override
    protected String percentile(Aggregate.Percentile percentile) {
        throw new QueryBuildException("sqlite does not support percentile aggregate on " + percentile.field());
    }
}
