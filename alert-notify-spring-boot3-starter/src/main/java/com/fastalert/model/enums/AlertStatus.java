package com.fastalert.model.enums;

/**
 * 告警状态
 */
public enum AlertStatus {
    /** 触发中 */
    FIRING("firing"),

    /** 已恢复 */
    RESOLVED("resolved");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    /** 模板/链接中使用的小写值 */
    public String value() {
        return value;
    }
}
