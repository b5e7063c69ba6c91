package com.fastalert.core.spi.notify;

/**
 * 已编译的消息模板, 不可变, 线程安全
 */
public interface MessageTemplate {

    /** 原始模板内容, 默认模板返回空串 */
    String source();

    boolean isDefault();
}
