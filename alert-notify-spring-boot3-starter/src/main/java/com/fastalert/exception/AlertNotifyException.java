package com.fastalert.exception;

/**
 * 告警通知异常基类
 */
public class AlertNotifyException extends RuntimeException {

    public AlertNotifyException(String message) {
        super(message);
    }

    public AlertNotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
