package com.fastalert.exception;

/**
 * 模板执行失败, 包装模板引擎的原始诊断信息
 */
public class AlertRenderException extends AlertNotifyException {

    public AlertRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
