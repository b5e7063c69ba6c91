package com.fastalert.exception;

public class AlertDispatchException extends AlertNotifyException {

    public AlertDispatchException(String message) {
        super(message);
    }

    public AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
