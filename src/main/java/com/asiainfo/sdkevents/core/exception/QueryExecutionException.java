package com.asiainfo.sdkevents.core.exception;

/**
 * 后端拒绝或执行查询失败（连接、语法、资源限制等）
 */
public class QueryExecutionException extends MetricsException {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
