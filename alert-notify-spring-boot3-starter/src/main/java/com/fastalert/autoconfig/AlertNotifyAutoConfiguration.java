package com.fastalert.autoconfig;

import com.fastalert.config.AlertNotifyProperties;
import com.fastalert.core.dispatch.CommandBusLifecycle;
import com.fastalert.core.dispatch.InProcessCommandBus;
import com.fastalert.core.dispatch.mail.EmailCommandHandler;
import com.fastalert.core.dispatch.mail.LoggingMailTransport;
import com.fastalert.core.dispatch.mail.MailLayoutRenderer;
import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.notify.AlertLinks;
import com.fastalert.core.notify.NotificationGroups;
import com.fastalert.core.notify.NotifierFactory;
import com.fastalert.core.notify.notifier.EmailNotifierProvider;
import com.fastalert.core.notify.template.MustacheNotifierTemplate;
import com.fastalert.core.spi.dispatch.CommandHandler;
import com.fastalert.core.spi.dispatch.DispatchChannel;
import com.fastalert.core.spi.mail.MailTransport;
import com.fastalert.core.spi.notify.NotifierProvider;
import com.fastalert.core.spi.notify.NotifierTemplate;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@AutoConfiguration(after = AlertNotifyMetricsAutoConfiguration.class)
@EnableConfigurationProperties(AlertNotifyProperties.class)
@ConditionalOnProperty(prefix = "alert.notify", name = "enabled", matchIfMissing = true)
public class AlertNotifyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "alertNotifyClock")
    public Clock alertNotifyClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertLinks alertLinks(AlertNotifyProperties props) {
        return new AlertLinks(props.getExternalUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationGroups notificationGroups(AlertLinks links, Clock alertNotifyClock) {
        return new NotificationGroups(links, alertNotifyClock);
    }

    @Bean
    @ConditionalOnMissingBean(NotifierTemplate.class)
    public NotifierTemplate notifierTemplate() {
        return new MustacheNotifierTemplate();
    }

    @Bean
    @ConditionalOnMissingBean(MailTransport.class)
    public MailTransport mailTransport() {
        return new LoggingMailTransport();
    }

    @Bean
    @ConditionalOnMissingBean
    public MailLayoutRenderer mailLayoutRenderer() {
        return new MailLayoutRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailCommandHandler emailCommandHandler(MailLayoutRenderer renderer,
                                                   MailTransport transport,
                                                   AlertNotifyProperties props) {
        AlertNotifyProperties.Smtp smtp = props.getSmtp();
        return new EmailCommandHandler(renderer, transport, smtp.getFromName(), smtp.getFromAddress(), smtp.getContentTypes());
    }

    @Bean
    @ConditionalOnMissingBean(name = "emailNotifierProvider")
    public NotifierProvider emailNotifierProvider(NotifierTemplate tmpl,
                                                  NotificationGroups groups,
                                                  DispatchChannel channel,
                                                  NotifyMetrics metrics) {
        return new EmailNotifierProvider(tmpl, groups, channel, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifierFactory notifierFactory(ObjectProvider<NotifierProvider> providers) {
        return new NotifierFactory(providers.orderedStream().collect(Collectors.toList()));
    }

    /**
     * 未提供 DispatchChannel 时使用进程内总线
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(DispatchChannel.class)
    static class CommandBusConfiguration {

        @Bean
        public InProcessCommandBus inProcessCommandBus(ObjectProvider<CommandHandler<?>> handlers,
                                                       NotifyMetrics metrics,
                                                       AlertNotifyProperties props) {
            AlertNotifyProperties.Dispatch cfg = props.getDispatch();
            AtomicInteger seq = new AtomicInteger();
            ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                    cfg.getMaxPoolSize(),
                    cfg.getKeepAlive().toSeconds(),
                    TimeUnit.SECONDS,
                    new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                    r -> {
                        Thread t = new Thread(r, "alert-dispatch-" + seq.incrementAndGet());
                        t.setDaemon(true);
                        t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("dispatch").error("uncaught", e));
                        return t;
                    },
                    new ThreadPoolExecutor.AbortPolicy());
            return new InProcessCommandBus(exec, handlers.orderedStream().collect(Collectors.toList()), metrics);
        }

        @Bean
        public CommandBusLifecycle commandBusLifecycle(InProcessCommandBus bus, AlertNotifyProperties props) {
            return new CommandBusLifecycle(bus, props);
        }
    }
}
