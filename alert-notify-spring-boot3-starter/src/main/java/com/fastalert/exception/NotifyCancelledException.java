package com.fastalert.exception;

/**
 * 调用方上下文被取消或超过截止时间
 * 不保证命令未被投递
 */
public class NotifyCancelledException extends AlertDispatchException {

    public NotifyCancelledException(String message) {
        super(message);
    }

    public NotifyCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
