package com.asiainfo.sdkevents.core.exception;

/**
 * 指标加载异常基类
 * 子类区分构建 / 执行 / 行解析三类失败，注册表原样透传，不做转换和重试
 */
public abstract class MetricsException extends RuntimeException {

    protected MetricsException(String message) {
        super(message);
    }

    protected MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
