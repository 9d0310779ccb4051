package com.asiainfo.sdkevents.config;

import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * SDK 事件指标配置
 * 统一管理后端引擎、维度策略、查询线程池等配置项
 */
@ApplicationScoped
public class SdkEventMetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(SdkEventMetricsConfig.class);

    static final String POLICY_KEY_TEMPLATE = "sdk-events.metrics.%s.unsupported-dimensions";

    /**
     * 当前使用的分析后端：sqlite / duckdb
     */
    @ConfigProperty(name = "sdk-events.analytics.engine", defaultValue = "sqlite")
    String engine;

    /**
     * 全局的不支持维度处理策略，可被 sdk-events.metrics.{metric}.unsupported-dimensions 覆盖
     */
    @ConfigProperty(name = "sdk-events.metrics.unsupported-dimensions", defaultValue = "DROP")
    String unsupportedDimensions;

    @ConfigProperty(name = "sdk-events.query.executor-threads", defaultValue = "16")
    int executorThreads;

    @PostConstruct
    void init() {
        log.info("=== SDK Event Metrics Configuration ===");
        log.info("Analytics engine:       {}", engine);
        log.info("Unsupported dimensions: {}", unsupportedDimensions);
        log.info("Query executor threads: {}", executorThreads);
        log.info("=======================================");
    }

    public String getEngine() {
        return engine;
    }

    public boolean isDuckDbEnabled() {
        return "duckdb".equalsIgnoreCase(engine);
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public UnsupportedDimensionPolicy getUnsupportedDimensionPolicy(SdkEventMetrics metric) {
        Optional<String> override = ConfigProvider.getConfig()
                .getOptionalValue(String.format(POLICY_KEY_TEMPLATE, metric.getName()), String.class);
        return resolvePolicy(unsupportedDimensions, override);
    }

    static UnsupportedDimensionPolicy resolvePolicy(String globalValue, Optional<String> override) {
        String value = override.filter(v -> !v.isBlank()).orElse(globalValue);
        if (value == null || value.isBlank()) {
            return UnsupportedDimensionPolicy.DROP;
        }
        try {
            return UnsupportedDimensionPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid unsupported-dimensions policy: " + value, e);
        }
    }
}
