package com.asiainfo.sdkevents.core.exception;

/**
 * 维度 / 过滤条件 / 时间粒度组合不被当前指标或后端支持
 */
public class QueryBuildException extends MetricsException {

    public QueryBuildException(String message) {
        super(message);
    }

    public QueryBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
