package com.asiainfo.sdkevents.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 时间桶宽度
 * 请求中不传 granularity 时整个时间范围只有一个桶
 */
public enum Granularity {
    @JsonProperty("G_ONEMIN")
    ONE_MIN(1),
    @JsonProperty("G_FIVEMIN")
    FIVE_MIN(5),
    @JsonProperty("G_FIFTEENMIN")
    FIFTEEN_MIN(15),
    @JsonProperty("G_THIRTYMIN")
    THIRTY_MIN(30),
    @JsonProperty("G_ONEHOUR")
    ONE_HOUR(60),
    @JsonProperty("G_ONEDAY")
    ONE_DAY(1440);

    private final int minutes;

    Granularity(int minutes) {
        this.minutes = minutes;
    }

    public int getMinutes() {
        return minutes;
    }

    public long getSeconds() {
        return minutes * 60L;
    }
}
