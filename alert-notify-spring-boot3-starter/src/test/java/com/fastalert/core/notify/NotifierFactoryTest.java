package com.fastalert.core.notify;

import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.notify.notifier.EmailNotifier;
import com.fastalert.core.notify.notifier.EmailNotifierProvider;
import com.fastalert.core.notify.template.MustacheNotifierTemplate;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.NotificationChannelConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NotifierFactory")
class NotifierFactoryTest {

    private final NotifierFactory factory = new NotifierFactory(List.of(new EmailNotifierProvider(
            new MustacheNotifierTemplate(),
            new NotificationGroups(new AlertLinks("http://localhost"), Clock.systemUTC()),
            cmd -> CompletableFuture.completedFuture(null),
            NotifyMetrics.noop())));

    @Test
    void createsEmailNotifier() {
        Notifier n = factory.create(NotificationChannelConfig.fromJson("ops", "EMAIL", "{\"addresses\": \"a@b.c\"}"));

        assertThat(n).isInstanceOf(EmailNotifier.class);
        assertThat(n.name()).isEqualTo("ops");
        assertThat(factory.types()).containsExactly("email");
    }

    @Test
    @DisplayName("未知类型报配置错误")
    void unknownType() {
        assertThatThrownBy(() -> factory.create(NotificationChannelConfig.fromJson("ops", "pagerduty", "{}")))
                .isInstanceOf(AlertConfigurationException.class)
                .hasMessageContaining("pagerduty");
    }

    @Test
    @DisplayName("配置非法时透传校验错误")
    void invalidSettings() {
        assertThatThrownBy(() -> factory.create(NotificationChannelConfig.fromJson("ops", "email", "{}")))
                .isInstanceOf(AlertConfigurationException.class)
                .hasMessageContaining("could not find addresses");
    }

    @Test
    void unparsableSettings() {
        assertThatThrownBy(() -> NotificationChannelConfig.fromJson("ops", "email", "{not json"))
                .isInstanceOf(AlertConfigurationException.class);
    }
}
