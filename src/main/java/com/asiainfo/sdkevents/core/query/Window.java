package com.asiainfo.sdkevents.core.query;

import java.util.List;

/**
 * 窗口表达式描述（OVER (PARTITION BY ... ORDER BY ...)）
 * 具体语法由 {@link SqlDialect#window(Window)} 翻译
 */
public interface Window {

    List<String> partitionBy();

    String orderBy();

    Order order();

    String alias();

    enum Order {
        ASC,
        DESC
    }

    record Sum(String field, List<String> partitionBy, String orderBy, Order order, String alias)
            implements Window {
        public Sum {
            partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
        }
    }

    record RowNumber(List<String> partitionBy, String orderBy, Order order, String alias) implements Window {
        public RowNumber {
            partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
        }
    }
}
