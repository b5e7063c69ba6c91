package com.fastalert.core.notify.notifier;

import com.fastalert.core.dispatch.InProcessCommandBus;
import com.fastalert.core.dispatch.mail.EmailCommandHandler;
import com.fastalert.core.dispatch.mail.MailLayoutRenderer;
import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.notify.AlertLinks;
import com.fastalert.core.notify.NotificationGroups;
import com.fastalert.core.notify.template.MustacheNotifierTemplate;
import com.fastalert.core.spi.mail.MailTransport;
import com.fastalert.model.Alert;
import com.fastalert.model.NotificationChannelConfig;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.model.mail.EmailMessage;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * notifier -> 命令总线 -> 邮件处理器 -> 传输层 全链路
 */
@DisplayName("EmailNotifier 集成")
class EmailNotifierIntegrationTest {

    private final List<EmailMessage> sent = new CopyOnWriteArrayList<>();

    private InProcessCommandBus bus;

    private NotifyMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = NotifyMetrics.noop();
        MailTransport transport = sent::add;
        EmailCommandHandler handler = new EmailCommandHandler(new MailLayoutRenderer(), transport,
                "Grafana Admin", "from@address.com", List.of("text/html", "text/plain"));
        bus = new InProcessCommandBus(Executors.newFixedThreadPool(2), List.of(handler), metrics);
    }

    @AfterEach
    void tearDown() {
        bus.shutdown(Duration.ofSeconds(1));
    }

    private EmailNotifier notifier(String message, boolean singleEmail) {
        ObjectNode settings = JsonNodeFactory.instance.objectNode()
                .put("addresses", "someops@example.com;somedev@example.com")
                .put("message", message)
                .put("singleEmail", singleEmail);
        return new EmailNotifier(new NotificationChannelConfig("ops", "email", settings),
                new MustacheNotifierTemplate(),
                new NotificationGroups(new AlertLinks("http://localhost/base"), Clock.systemUTC()),
                bus, metrics);
    }

    private static Alert alert(String name, String severity) {
        return Alert.builder()
                .label("alertname", name)
                .label("severity", severity)
                .annotation("runbook_url", "http://fix.me")
                .annotation(Alert.DASHBOARD_UID_ANNOTATION, "abc")
                .annotation(Alert.PANEL_ID_ANNOTATION, "5")
                .build();
    }

    private static final String CUSTOM = "Hi, this is a custom template.\n"
            + "{{#Alerts.Firing.size}}You have {{Alerts.Firing.size}} alerts firing.\n"
            + "{{#Alerts.Firing}} Firing: {{Labels.alertname}} at {{Labels.severity}} {{/Alerts.Firing}}"
            + "{{/Alerts.Firing.size}}";

    @Test
    @DisplayName("单条告警 + 自定义消息")
    void singleAlertCustomMessage() {
        boolean ok = notifier(CUSTOM, false).notify(NotifyContext.background(), alert("AlwaysFiring", "warning"));

        assertThat(ok).isTrue();
        EmailMessage first = sent.get(0);
        assertThat(first.getFrom()).isEqualTo("\"Grafana Admin\" <from@address.com>");
        assertThat(first.getTo()).containsExactly("someops@example.com");
        assertThat(first.getSubject()).isEqualTo("[FIRING:1]  (AlwaysFiring warning)");
        assertThat(first.getBody()).containsKeys("text/html", "text/plain");
        assertThat(first.getBody().get("text/html")).contains(
                "Hi, this is a custom template.",
                "You have 1 alerts firing.",
                "Firing: AlwaysFiring at warning");
    }

    @Test
    @DisplayName("默认按收件人逐个发送")
    void onePerRecipient() {
        notifier(CUSTOM, false).notify(NotifyContext.background(), alert("AlwaysFiring", "warning"));

        assertThat(sent).hasSize(2);
        assertThat(sent.get(0).getTo()).containsExactly("someops@example.com");
        assertThat(sent.get(1).getTo()).containsExactly("somedev@example.com");
    }

    @Test
    void singleEmailToAll() {
        notifier(CUSTOM, true).notify(NotifyContext.background(), alert("AlwaysFiring", "warning"));

        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).getTo()).containsExactly("someops@example.com", "somedev@example.com");
    }

    @Test
    @DisplayName("多条告警 + 自定义消息")
    void multipleAlertsCustomMessage() {
        notifier(CUSTOM, false).notify(NotifyContext.background(),
                alert("FiringOne", "warning"), alert("FiringTwo", "critical"));

        EmailMessage first = sent.get(0);
        assertThat(first.getSubject()).isEqualTo("[FIRING:2]  ");
        assertThat(first.getBody().get("text/html")).contains(
                "You have 2 alerts firing.",
                "Firing: FiringOne at warning",
                "Firing: FiringTwo at critical");
    }

    @Test
    @DisplayName("空消息使用默认模板内容")
    void emptyMessageUsesDefault() {
        notifier("", false).notify(NotifyContext.background(),
                alert("FiringOne", "warning"), alert("FiringTwo", "critical"));

        String html = sent.get(0).getBody().get("text/html");
        assertThat(html).contains(
                "Firing: 2 alerts",
                "<li>alertname: FiringOne</li><li>severity: warning</li>",
                "<li>alertname: FiringTwo</li><li>severity: critical</li>",
                "<a href=\"http://fix.me\"",
                "<a href=\"http://localhost/base/d/abc",
                "<a href=\"http://localhost/base/d/abc?viewPanel=5");
    }

    @Test
    @DisplayName("消息中的 HTML 被转义")
    void htmlInMessageIsEscaped() {
        String message = "<marquee>Hi, this is a custom template.</marquee>\n"
                + "{{#Alerts.Firing.size}}<ol>\n"
                + "{{#Alerts.Firing}}<li>Firing: {{Labels.alertname}} at {{Labels.severity}} </li> {{/Alerts.Firing}}\n"
                + "</ol>{{/Alerts.Firing.size}}";

        notifier(message, false).notify(NotifyContext.background(), alert("AlwaysFiring", "warning"));

        EmailMessage first = sent.get(0);
        assertThat(first.getSubject()).isEqualTo("[FIRING:1]  (AlwaysFiring warning)");
        assertThat(first.getBody().get("text/html")).contains(
                "&lt;marquee&gt;Hi, this is a custom template.&lt;/marquee&gt;",
                "&lt;li&gt;Firing: AlwaysFiring at warning &lt;/li&gt;");
        assertThat(first.getBody().get("text/plain")).contains("<marquee>Hi, this is a custom template.</marquee>");
    }

    @Test
    void metricsRecorded() {
        notifier("", false).notify(NotifyContext.background(), alert("AlwaysFiring", "warning"));

        assertThat(metrics.registry().get("alert.notify.sent").tag("type", "email").counter().count()).isEqualTo(1.0);
        assertThat(metrics.registry().get("alert.dispatch.completed").counter().count()).isEqualTo(1.0);
        assertThat(metrics.registry().get("alert.notify.time").tag("type", "email").timer().count()).isEqualTo(1L);
    }
}
