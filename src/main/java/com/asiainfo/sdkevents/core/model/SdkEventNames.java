package com.asiainfo.sdkevents.core.model;

/**
 * SDK 上报的事件名（event_name 列取值），只列出指标用到的事件
 */
public enum SdkEventNames {
    ORCA_ELEMENTS_CALLED,
    APP_RENDERED,
    PAYMENT_METHOD_CHANGED,
    PAYMENT_DATA_FILLED,
    PAYMENT_ATTEMPT,
    PAYMENT_METHODS_CALL,
    AUTHENTICATION_CALL,
    THREE_DS_METHOD_CALL,
    THREE_DS_METHOD_RESULT,
    THREE_DS_METHOD,
    DISPLAY_THREE_DS_SDK
}
