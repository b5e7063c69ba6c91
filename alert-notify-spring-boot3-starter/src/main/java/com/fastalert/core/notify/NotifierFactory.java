package com.fastalert.core.notify;

import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.notify.NotifierProvider;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.NotificationChannelConfig;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 渠道注册中心, 按 type 创建 Notifier
 */
public class NotifierFactory {

    private final Map<String, NotifierProvider> providers = new ConcurrentHashMap<>(8);

    public NotifierFactory(List<NotifierProvider> providers) {
        if (providers != null) {
            providers.forEach(this::registry);
        }
    }

    /**
     * 创建并校验, 配置非法时抛出 AlertConfigurationException
     */
    public Notifier create(NotificationChannelConfig config) {
        String type = config.getType() == null ? "" : config.getType().trim().toLowerCase(Locale.ROOT);
        NotifierProvider p = providers.get(type);
        if (p == null) {
            throw new AlertConfigurationException("unsupported notification channel type '" + config.getType()
                    + "' for channel '" + config.getName() + "'");
        }
        return p.create(config);
    }

    /**
     * 注册, 同类型后注册的覆盖先注册的
     */
    public NotifierFactory registry(NotifierProvider p) {
        providers.put(p.type().toLowerCase(Locale.ROOT), p);
        return this;
    }

    /** 列出已注册类型 */
    public Set<String> types() { return Collections.unmodifiableSet(providers.keySet()); }
}
