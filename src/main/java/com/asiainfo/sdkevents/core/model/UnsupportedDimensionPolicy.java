package com.asiainfo.sdkevents.core.model;

/**
 * 请求了指标不支持的维度时的处理方式
 * DROP: 静默忽略该维度
 * REJECT: 抛出 QueryBuildException
 */
public enum UnsupportedDimensionPolicy {
    DROP,
    REJECT
}
