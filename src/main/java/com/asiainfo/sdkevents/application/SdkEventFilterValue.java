package com.asiainfo.sdkevents.application;

import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SdkEventFilterValue(
        @JsonProperty("dimension") SdkEventDimensions dimension,
        @JsonProperty("values") List<String> values
) {
}
