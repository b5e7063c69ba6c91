package com.fastalert.core.notify.notifier;

import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.notify.NotificationGroups;
import com.fastalert.core.spi.dispatch.DispatchChannel;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.notify.NotifierProvider;
import com.fastalert.core.spi.notify.NotifierTemplate;
import com.fastalert.model.NotificationChannelConfig;

public class EmailNotifierProvider implements NotifierProvider {

    private final NotifierTemplate tmpl;

    private final NotificationGroups groups;

    private final DispatchChannel channel;

    private final NotifyMetrics metrics;

    public EmailNotifierProvider(NotifierTemplate tmpl, NotificationGroups groups,
                                 DispatchChannel channel, NotifyMetrics metrics) {
        this.tmpl = tmpl;
        this.groups = groups;
        this.channel = channel;
        this.metrics = metrics;
    }

    @Override
    public String type() {
        return EmailNotifier.TYPE;
    }

    @Override
    public Notifier create(NotificationChannelConfig config) {
        return new EmailNotifier(config, tmpl, groups, channel, metrics);
    }
}
