package com.fastalert.core.notify.notifier;

import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.notify.Dispatches;
import com.fastalert.core.notify.NotificationGroups;
import com.fastalert.core.spi.dispatch.DispatchChannel;
import com.fastalert.core.spi.notify.MessageTemplate;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.notify.NotifierTemplate;
import com.fastalert.exception.AlertNotifyException;
import com.fastalert.exception.AlertRenderException;
import com.fastalert.exception.NotifyCancelledException;
import com.fastalert.model.Alert;
import com.fastalert.model.NotificationChannelConfig;
import com.fastalert.model.command.SendEmailCommand;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.model.view.NotificationGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 邮件通知
 * 渲染标题/内容后生成 SendEmailCommand, 交给 DispatchChannel 投递
 */
public class EmailNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

    public static final String TYPE = "email";

    /** 内置邮件布局 */
    public static final String LAYOUT = "ng_alert_notification";

    private final String name;

    private final EmailSettings settings;

    private final MessageTemplate message;

    private final NotifierTemplate tmpl;

    private final NotificationGroups groups;

    private final DispatchChannel channel;

    private final NotifyMetrics metrics;

    public EmailNotifier(NotificationChannelConfig config,
                         NotifierTemplate tmpl,
                         NotificationGroups groups,
                         DispatchChannel channel,
                         NotifyMetrics metrics) {
        // 校验失败直接抛出, 不会产生半初始化的实例
        this.settings = EmailSettings.from(config);
        this.message = tmpl.compile(settings.getMessage());
        this.name = config.getName();
        this.tmpl = tmpl;
        this.groups = groups;
        this.channel = channel;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean notify(NotifyContext ctx, List<Alert> alerts) {
        long start = System.nanoTime();
        try {
            SendEmailCommand cmd = buildCommand(ctx, alerts);
            Dispatches.publishAndAwait(channel, cmd, ctx);
            metrics.incSent(TYPE);
            log.debug("[Notify-{}] channel={} subject={} to={} published", TYPE, name, cmd.getSubject(), cmd.getTo());
            return true;
        } catch (NotifyCancelledException e) {
            metrics.incCancelled(TYPE);
            throw e;
        } catch (AlertNotifyException e) {
            metrics.incFailed(TYPE);
            throw e;
        } finally {
            metrics.recordNotifyNanos(TYPE, System.nanoTime() - start);
        }
    }

    SendEmailCommand buildCommand(NotifyContext ctx, List<Alert> alerts) {
        NotificationGroup group = groups.build(ctx, alerts);
        String title;
        String body;
        try {
            title = tmpl.renderTitle(group);
            body = tmpl.renderMessage(message, group, title);
        } catch (AlertRenderException e) {
            metrics.incRenderFailed(TYPE);
            throw e;
        }
        return SendEmailCommand.builder()
                .subject(title)
                .to(settings.getAddresses())
                .singleEmail(settings.isSingleEmail())
                .template(LAYOUT)
                .data(group.toData(title, body))
                .build();
    }

    public EmailSettings getSettings() {
        return settings;
    }
}
