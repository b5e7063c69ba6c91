package com.fastalert.exception;

/**
 * 渠道配置非法（缺少必填项、模板语法错误、未知渠道类型）
 * 只在构造 Notifier 时抛出
 */
public class AlertConfigurationException extends AlertNotifyException {

    public AlertConfigurationException(String message) {
        super(message);
    }

    public AlertConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
