package com.fastalert.core.spi.notify;

import com.fastalert.model.NotificationChannelConfig;

/**
 * 按渠道类型创建 Notifier
 */
public interface NotifierProvider {

    /** 支持的渠道类型 */
    String type();

    Notifier create(NotificationChannelConfig config);
}
