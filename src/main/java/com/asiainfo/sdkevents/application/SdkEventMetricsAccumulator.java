package com.asiainfo.sdkevents.application;

import com.asiainfo.sdkevents.core.model.SdkEventMetricRow;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 单个桶内多个指标的结果合并
 * 计数类指标累加 count；平均类指标按 count 加权合并 total
 */
public class SdkEventMetricsAccumulator {

    private final Map<SdkEventMetrics, MetricAccumulator> accumulators = new EnumMap<>(SdkEventMetrics.class);

    public void add(SdkEventMetrics metric, SdkEventMetricRow row) {
        accumulators.computeIfAbsent(metric, SdkEventMetricsAccumulator::newAccumulator).add(row);
    }

    public Map<SdkEventMetrics, Number> collect() {
        Map<SdkEventMetrics, Number> values = new EnumMap<>(SdkEventMetrics.class);
        accumulators.forEach((metric, accumulator) -> {
            Number value = accumulator.collect();
            if (value != null) {
                values.put(metric, value);
            }
        });
        return Collections.unmodifiableMap(values);
    }

    static MetricAccumulator newAccumulator(SdkEventMetrics metric) {
        if (metric == SdkEventMetrics.AVERAGE_PAYMENT_TIME) {
            return new AverageAccumulator();
        }
        return new CountAccumulator();
    }

    interface MetricAccumulator {
        void add(SdkEventMetricRow row);

        Number collect();
    }

    static class CountAccumulator implements MetricAccumulator {
        private Long count;

        @Override
        public void add(SdkEventMetricRow row) {
            if (row.count() != null) {
                count = count == null ? row.count() : count + row.count();
            }
        }

        @Override
        public Number collect() {
            return count;
        }
    }

    static class AverageAccumulator implements MetricAccumulator {
        private BigDecimal weightedTotal = BigDecimal.ZERO;
        private long count;

        @Override
        public void add(SdkEventMetricRow row) {
            if (row.total() == null) {
                return;
            }
            // 没有 count 的行按 1 条计权
            long weight = row.count() == null ? 1L : row.count();
            weightedTotal = weightedTotal.add(row.total().multiply(BigDecimal.valueOf(weight)));
            count += weight;
        }

        @Override
        public Number collect() {
            if (count == 0) {
                return null;
            }
            return weightedTotal.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
        }
    }
}
