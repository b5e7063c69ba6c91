package com.fastalert.core.spi.notify;

import com.fastalert.model.view.NotificationGroup;

public interface NotifierTemplate {

    /** 编译消息模板, 空模板使用内置 default.message; 语法错误抛 AlertConfigurationException */
    MessageTemplate compile(String source);

    /** 渲染标题 */
    String renderTitle(NotificationGroup group);

    /** 渲染内容, 执行失败抛 AlertRenderException */
    String renderMessage(MessageTemplate template, NotificationGroup group, String title);
}
