package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.config.SdkEventMetricsConfig;
import com.asiainfo.sdkevents.core.datasource.AnalyticsDataSource;
import com.asiainfo.sdkevents.core.datasource.SdkEventMetricAnalytics;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.MetricBucket;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilters;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 指标注册表 / 分发器
 * 启动时为每个 SdkEventMetrics 注册一个策略，之后只读。
 * loadMetrics 只做选择：参数原样转交策略，结果与异常原样返回，不做任何校验、默认值或转换。
 */
@ApplicationScoped
public class SdkEventMetricRegistry {

    private static final Logger log = LoggerFactory.getLogger(SdkEventMetricRegistry.class);

    @Inject
    SdkEventMetricsConfig metricsConfig;

    private Map<SdkEventMetrics, SdkEventMetric> strategies = Collections.emptyMap();

    public SdkEventMetricRegistry() {
    }

    SdkEventMetricRegistry(Map<SdkEventMetrics, SdkEventMetric> strategies) {
        Map<SdkEventMetrics, SdkEventMetric> copy = new EnumMap<>(SdkEventMetrics.class);
        copy.putAll(strategies);
        this.strategies = Collections.unmodifiableMap(copy);
    }

    @PostConstruct
    void init() {
        Map<SdkEventMetrics, SdkEventMetric> registered = new EnumMap<>(SdkEventMetrics.class);
        for (SdkEventMetrics kind : SdkEventMetrics.values()) {
            registered.put(kind, createStrategy(kind, metricsConfig.getUnsupportedDimensionPolicy(kind)));
        }
        this.strategies = Collections.unmodifiableMap(registered);
        log.info("Registered {} sdk event metrics", registered.size());
    }

    /**
     * 每个指标对应的策略，switch 覆盖全部枚举值，漏掉新指标时编译失败
     */
    static SdkEventMetric createStrategy(SdkEventMetrics kind, UnsupportedDimensionPolicy policy) {
        return switch (kind) {
            case PAYMENT_ATTEMPTS -> new PaymentAttempts(policy);
            case PAYMENT_METHODS_CALL_COUNT -> new PaymentMethodsCallCount(policy);
            case SDK_RENDERED_COUNT -> new SdkRenderedCount(policy);
            case SDK_INITIATED_COUNT -> new SdkInitiatedCount(policy);
            case PAYMENT_METHOD_SELECTED_COUNT -> new PaymentMethodSelectedCount(policy);
            case PAYMENT_DATA_FILLED_COUNT -> new PaymentDataFilledCount(policy);
            case AVERAGE_PAYMENT_TIME -> new AveragePaymentTime(policy);
            case THREE_DS_METHOD_SKIPPED_COUNT -> new ThreeDsMethodSkippedCount(policy);
            case THREE_DS_METHOD_INVOKED_COUNT -> new ThreeDsMethodInvokedCount(policy);
            case THREE_DS_METHOD_SUCCESSFUL_COUNT -> new ThreeDsMethodSuccessfulCount(policy);
            case THREE_DS_METHOD_UNSUCCESSFUL_COUNT -> new ThreeDsMethodUnsuccessfulCount(policy);
            case THREE_DS_CHALLENGE_FLOW_COUNT -> new ThreeDsChallengeFlowCount(policy);
            case THREE_DS_FRICTIONLESS_FLOW_COUNT -> new ThreeDsFrictionlessFlowCount(policy);
            case AUTHENTICATION_UNSUCCESSFUL_COUNT -> new AuthenticationUnsuccessfulCount(policy);
        };
    }

    public <T extends AnalyticsDataSource & SdkEventMetricAnalytics> CompletableFuture<List<MetricBucket>> loadMetrics(
            SdkEventMetrics kind,
            List<SdkEventDimensions> dimensions,
            String publishableKey,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            T dataSource) {
        return getStrategy(kind).loadMetrics(dimensions, publishableKey, filters, granularity, timeRange, dataSource);
    }

    public SdkEventMetric getStrategy(SdkEventMetrics kind) {
        SdkEventMetric strategy = strategies.get(kind);
        if (strategy == null) {
            throw new IllegalStateException("No strategy registered for metric " + kind);
        }
        return strategy;
    }
}
