package com.asiainfo.sdkevents.core.model;

/**
 * 分析数据集（逻辑表），物理表名由各后端的 SqlDialect 决定
 */
public enum AnalyticsCollection {
    SDK_EVENTS("sdk_events");

    private final String defaultTableName;

    AnalyticsCollection(String defaultTableName) {
        this.defaultTableName = defaultTableName;
    }

    public String getDefaultTableName() {
        return defaultTableName;
    }
}
