package com.asiainfo.sdkevents.core.query;

import com.asiainfo.sdkevents.core.datasource.AnalyticsDataSource;
import com.asiainfo.sdkevents.core.datasource.LoadRow;
import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.model.AnalyticsCollection;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.SqlRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 查询构建器
 * 收集 select / where / group by 片段，翻译时才绑定到具体后端的方言。
 * 所有片段按添加顺序输出，相同的参数对同一后端总是生成相同的 SQL 和参数列表。
 * 过滤值一律走绑定参数，时间戳走方言字面量。
 *
 * @param <T> 目标后端类型
 */
public class QueryBuilder<T extends AnalyticsDataSource> {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

    public static final String TIME_BUCKET = "time_bucket";

    private final AnalyticsCollection table;
    private final List<Function<SqlDialect, String>> columns = new ArrayList<>();
    private final List<Condition> filters = new ArrayList<>();
    private final List<Function<SqlDialect, String>> groupBy = new ArrayList<>();
    private boolean distinct;

    public QueryBuilder(AnalyticsCollection table) {
        this.table = table;
    }

    public QueryBuilder<T> addSelectColumn(String column) {
        columns.add(d -> column);
        return this;
    }

    public QueryBuilder<T> addSelectColumn(Aggregate aggregate) {
        columns.add(d -> d.aggregate(aggregate) + " AS " + aggregate.alias());
        return this;
    }

    public QueryBuilder<T> addSelectColumn(Window window) {
        columns.add(d -> d.window(window) + " AS " + window.alias());
        return this;
    }

    /**
     * 按时间粒度分桶：select 与 group by 同时加入分桶表达式，结果列为 time_bucket
     */
    public QueryBuilder<T> addGranularityInMins(Granularity granularity, String column) {
        columns.add(d -> d.timeBucket(granularity, column) + " AS " + TIME_BUCKET);
        groupBy.add(d -> d.timeBucket(granularity, column));
        return this;
    }

    public QueryBuilder<T> addFilterClause(String column, Object value) {
        return addCustomFilterClause(column, value, FilterType.EQUAL);
    }

    public QueryBuilder<T> addCustomFilterClause(String column, Object value, FilterType type) {
        filters.add(new ParamCondition(column, type, value == null ? List.of() : Collections.singletonList(value)));
        return this;
    }

    public QueryBuilder<T> addFilterInClause(String column, Collection<?> values) {
        filters.add(new ParamCondition(column, FilterType.IN, new ArrayList<>(values)));
        return this;
    }

    public QueryBuilder<T> addNotNullClause(String column) {
        filters.add(new ParamCondition(column, FilterType.IS_NOT_NULL, List.of()));
        return this;
    }

    public QueryBuilder<T> addTimestampFilterClause(String column, Instant value, FilterType type) {
        filters.add(new LiteralCondition(column, type, d -> d.timestamp(value)));
        return this;
    }

    public QueryBuilder<T> addGroupByClause(String column) {
        groupBy.add(d -> column);
        return this;
    }

    public QueryBuilder<T> distinct() {
        this.distinct = true;
        return this;
    }

    /**
     * 翻译为目标方言的 SQL
     */
    public SqlRequest build(SqlDialect dialect) throws QueryBuildException {
        if (columns.isEmpty()) {
            throw new QueryBuildException("No select columns for query on " + table);
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(render(columns, dialect));
        sql.append(" FROM ").append(dialect.collection(table));

        if (!filters.isEmpty()) {
            sql.append(" WHERE ");
            List<String> parts = new ArrayList<>(filters.size());
            for (Condition filter : filters) {
                parts.add(filter.render(dialect, params));
            }
            sql.append(String.join(" AND ", parts));
        }

        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(render(groupBy, dialect));
        }
        return new SqlRequest(sql.toString(), Collections.unmodifiableList(params));
    }

    /**
     * 构建并在后端执行，逐行交给 loader 反序列化；任一步失败整个 future 失败
     */
    public <R> CompletableFuture<List<R>> executeQuery(T dataSource, LoadRow<R> loader) {
        SqlRequest request;
        try {
            request = build(dataSource.dialect());
        } catch (QueryBuildException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("[{}] SQL: {} params: {}", dataSource.getEngineName(), request.sql(), request.params());

        return dataSource.execute(request).thenApply(rows -> {
            List<R> loaded = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                loaded.add(loader.load(row));
            }
            return loaded;
        });
    }

    private static String render(List<Function<SqlDialect, String>> fragments, SqlDialect dialect) {
        List<String> parts = new ArrayList<>(fragments.size());
        for (Function<SqlDialect, String> fragment : fragments) {
            parts.add(fragment.apply(dialect));
        }
        return String.join(", ", parts);
    }

    private interface Condition {
        String render(SqlDialect dialect, List<Object> params);
    }

    private record ParamCondition(String column, FilterType type, List<Object> values) implements Condition {

        @Override
        public String render(SqlDialect dialect, List<Object> params) {
            switch (type) {
                case IS_NOT_NULL:
                    return column + " IS NOT NULL";
                case IN:
                case NOT_IN:
                    if (values.isEmpty()) {
                        throw new QueryBuildException("Empty value list for " + type + " filter on " + column);
                    }
                    params.addAll(values);
                    return column + " " + type.getOperator() + " ("
                            + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
                default:
                    if (values.isEmpty()) {
                        throw new QueryBuildException("Missing value for " + type + " filter on " + column);
                    }
                    params.add(values.get(0));
                    return column + " " + type.getOperator() + " ?";
            }
        }
    }

    private record LiteralCondition(String column, FilterType type, Function<SqlDialect, String> literal)
            implements Condition {

        @Override
        public String render(SqlDialect dialect, List<Object> params) {
            if (type == FilterType.IN || type == FilterType.NOT_IN || type == FilterType.IS_NOT_NULL) {
                throw new QueryBuildException("Unsupported literal filter type " + type + " on " + column);
            }
            return column + " " + type.getOperator() + " " + literal.apply(dialect);
        }
    }
}
