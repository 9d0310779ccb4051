package com.asiainfo.sdkevents.core.query;

/**
 * 与后端无关的聚合表达式描述
 * 具体语法由 {@link SqlDialect#aggregate(Aggregate)} 翻译
 */
public interface Aggregate {

    /**
     * 结果列别名
     */
    String alias();

    /**
     * COUNT(field)，field 为空时为 COUNT(*)
     */
    record Count(String field, String alias) implements Aggregate {
    }

    record DistinctCount(String field, String alias) implements Aggregate {
    }

    record Sum(String field, String alias) implements Aggregate {
    }

    record Min(String field, String alias) implements Aggregate {
    }

    record Max(String field, String alias) implements Aggregate {
    }

    record Avg(String field, String alias) implements Aggregate {
    }

    /**
     * 百分位数，percentile 取值 0-100
     */
    record Percentile(String field, String alias, int percentile) implements Aggregate {
        public Percentile {
            if (percentile < 0 || percentile > 100) {
                throw new IllegalArgumentException("percentile must be within [0, 100]: " + percentile);
            }
        }
    }

    static Aggregate count(String alias) {
        return new Count(null, alias);
    }

    static Aggregate distinctCount(String field, String alias) {
        return new DistinctCount(field, alias);
    }

    static Aggregate sum(String field, String alias) {
        return new Sum(field, alias);
    }

    static Aggregate avg(String field, String alias) {
        return new Avg(field, alias);
    }
}
