package com.asiainfo.sdkevents.core.exception;

/**
 * 后端返回的行无法反序列化为结果行
 */
public class RowParseException extends MetricsException {

    public RowParseException(String message) {
        super(message);
    }

    public RowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
