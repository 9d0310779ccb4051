package com.asiainfo.sdkevents.api;

import com.asiainfo.sdkevents.api.dto.GetSdkEventFiltersRequest;
import com.asiainfo.sdkevents.api.dto.GetSdkEventMetricRequest;
import com.asiainfo.sdkevents.api.dto.SdkEventQueryResult;
import com.asiainfo.sdkevents.application.SdkEventAnalyticsService;
import com.asiainfo.sdkevents.application.SdkEventFilterValue;
import com.asiainfo.sdkevents.application.SdkEventMetricsBucketResponse;
import com.asiainfo.sdkevents.core.exception.MetricsException;
import com.asiainfo.sdkevents.core.model.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * SDK 事件分析 REST API
 * 租户由请求头 X-Publishable-Key 指定，返回格式统一为 dataArray, status, msg
 */
@ApplicationScoped
@Path("/api/v1/analytics/sdk_events")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SdkEventAnalyticsResource {

    private static final Logger log = LoggerFactory.getLogger(SdkEventAnalyticsResource.class);

    static final String PUBLISHABLE_KEY_HEADER = "X-Publishable-Key";

    @Inject
    SdkEventAnalyticsService analyticsService;

    @POST
    @Path("/metrics")
    public CompletionStage<SdkEventQueryResult> getMetrics(
            @HeaderParam(PUBLISHABLE_KEY_HEADER) String publishableKey,
            GetSdkEventMetricRequest request) {

        String invalid = validate(publishableKey, request == null ? null : request.timeRange());
        if (invalid == null && request.metrics().isEmpty()) {
            invalid = "metrics 不能为空";
        }
        if (invalid != null) {
            return CompletableFuture.completedFuture(SdkEventQueryResult.error(invalid));
        }

        log.info("收到指标查询请求: {}", request);
        long start = System.currentTimeMillis();
        return analyticsService.getMetrics(publishableKey, request)
                .thenApply(buckets -> {
                    List<Map<String, Object>> rows = new ArrayList<>(buckets.size());
                    for (SdkEventMetricsBucketResponse bucket : buckets) {
                        rows.add(bucket.toDataRow());
                    }
                    return SdkEventQueryResult.success(rows, successMessage(rows.size(), start));
                })
                .exceptionally(SdkEventAnalyticsResource::toErrorResult);
    }

    @POST
    @Path("/filters")
    public CompletionStage<SdkEventQueryResult> getFilters(
            @HeaderParam(PUBLISHABLE_KEY_HEADER) String publishableKey,
            GetSdkEventFiltersRequest request) {

        String invalid = validate(publishableKey, request == null ? null : request.timeRange());
        if (invalid != null) {
            return CompletableFuture.completedFuture(SdkEventQueryResult.error(invalid));
        }

        log.info("收到维度查询请求: {}", request);
        long start = System.currentTimeMillis();
        return analyticsService.getFilters(publishableKey, request)
                .thenApply(values -> {
                    List<Map<String, Object>> rows = new ArrayList<>(values.size());
                    for (SdkEventFilterValue value : values) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("dimension", value.dimension().getColumn());
                        row.put("values", value.values());
                        rows.add(row);
                    }
                    return SdkEventQueryResult.success(rows, successMessage(rows.size(), start));
                })
                .exceptionally(SdkEventAnalyticsResource::toErrorResult);
    }

    private static String validate(String publishableKey, TimeRange timeRange) {
        if (publishableKey == null || publishableKey.isBlank()) {
            return "缺少请求头 " + PUBLISHABLE_KEY_HEADER;
        }
        if (timeRange == null) {
            return "time_range 不能为空";
        }
        return null;
    }

    private String successMessage(int size, long start) {
        return "查询成功！耗时 " + (System.currentTimeMillis() - start) + " ms, 返回 " + size + " 条记录 ["
                + analyticsService.getEngineDescription() + "]";
    }

    static SdkEventQueryResult toErrorResult(Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
        if (cause instanceof MetricsException) {
            log.warn("查询失败: {}", cause.getMessage());
        } else {
            log.error("查询异常", cause);
        }
        return SdkEventQueryResult.error("查询失败: " + cause.getMessage());
    }
}
