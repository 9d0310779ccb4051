package com.asiainfo.sdkevents.core.model;

import java.util.List;

/**
 * 翻译后的 SQL 及按占位符顺序排列的绑定参数
 */
public record SqlRequest(String sql, List<Object> params) {
}
