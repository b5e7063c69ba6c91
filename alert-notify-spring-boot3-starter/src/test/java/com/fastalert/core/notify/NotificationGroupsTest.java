package com.fastalert.core.notify;

import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.model.view.ExtendedAlert;
import com.fastalert.model.view.LabelSet;
import com.fastalert.model.view.NotificationGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationGroups")
class NotificationGroupsTest {

    private static final Instant NOW = Instant.parse("2021-06-01T10:00:00Z");

    private final NotificationGroups groups = new NotificationGroups(
            new AlertLinks("http://localhost/base"), Clock.fixed(NOW, ZoneOffset.UTC));

    private static Alert alert(String name, String severity) {
        return Alert.builder()
                .label("alertname", name)
                .label("severity", severity)
                .annotation("runbook_url", "http://fix.me")
                .annotation(Alert.DASHBOARD_UID_ANNOTATION, "abc")
                .annotation(Alert.PANEL_ID_ANNOTATION, "5")
                .build();
    }

    @Nested
    @DisplayName("单条告警")
    class SingleAlert {

        @Test
        @DisplayName("元数据注解不展示, 但用于生成链接")
        void metadataStripped() {
            NotificationGroup g = groups.build(NotifyContext.background(), List.of(alert("AlwaysFiring", "warning")));

            ExtendedAlert a = g.getAlerts().get(0);
            assertThat(a.getStatus()).isEqualTo("firing");
            assertThat(a.getAnnotations().asMap()).containsExactly(Map.entry("runbook_url", "http://fix.me"));
            assertThat(a.getFingerprint()).isEqualTo("15a37193dce72bab");
            assertThat(a.getDashboardURL()).isEqualTo("http://localhost/base/d/abc");
            assertThat(a.getPanelURL()).isEqualTo("http://localhost/base/d/abc?viewPanel=5");
            assertThat(g.getCommonAnnotations().asMap()).containsOnlyKeys("runbook_url");
        }

        @Test
        void noDashboardMeansNoLinks() {
            Alert bare = Alert.of(Map.of("alertname", "Bare"), Map.of());

            ExtendedAlert a = groups.build(NotifyContext.background(), List.of(bare)).getAlerts().get(0);

            assertThat(a.getDashboardURL()).isEmpty();
            assertThat(a.getPanelURL()).isEmpty();
            assertThat(a.getSilenceURL()).endsWith("matchers=alertname%3DBare");
        }

        @Test
        @DisplayName("保留起止时间与来源链接")
        void timesAndSource() {
            Instant started = NOW.minusSeconds(600);
            Alert src = Alert.builder()
                    .label("alertname", "Timed")
                    .startsAt(started)
                    .endsAt(NOW.plusSeconds(60))
                    .generatorUrl("http://prom/graph?g0.expr=up")
                    .build();

            ExtendedAlert a = groups.build(NotifyContext.background(), List.of(src)).getAlerts().get(0);

            assertThat(a.getStartsAt()).isEqualTo(started);
            assertThat(a.getEndsAt()).isEqualTo(NOW.plusSeconds(60));
            assertThat(a.getGeneratorURL()).isEqualTo("http://prom/graph?g0.expr=up");
        }

        @Test
        void missingSourceIsEmpty() {
            ExtendedAlert a = groups.build(NotifyContext.background(), List.of(alert("NoSource", "info"))).getAlerts().get(0);

            assertThat(a.getGeneratorURL()).isEmpty();
            assertThat(a.getEndsAt()).isNull();
        }
    }

    @Nested
    @DisplayName("多条告警")
    class MultipleAlerts {

        @Test
        @DisplayName("公共标签取交集, 告警顺序保持输入顺序")
        void intersection() {
            NotificationGroup g = groups.build(NotifyContext.background(),
                    List.of(alert("FiringOne", "warning"), alert("FiringTwo", "critical")));

            List<String> names = g.getAlerts().stream()
                    .map(x -> x.getLabels().value("alertname"))
                    .collect(Collectors.toList());
            assertThat(names).containsExactly("FiringOne", "FiringTwo");
            assertThat(g.getCommonLabels()).isEqualTo(LabelSet.empty());
            assertThat(g.getCommonAnnotations().asMap()).containsExactly(Map.entry("runbook_url", "http://fix.me"));
        }

        @Test
        @DisplayName("endsAt 早于当前时间为 resolved, 有一条 firing 整组即 firing")
        void statusFromClock() {
            Alert resolved = Alert.builder().label("alertname", "Old").endsAt(NOW.minusSeconds(60)).build();
            Alert firing = Alert.builder().label("alertname", "New").endsAt(NOW.plusSeconds(60)).build();

            NotificationGroup mixed = groups.build(NotifyContext.background(), List.of(resolved, firing));
            assertThat(mixed.getStatus()).isEqualTo("firing");
            assertThat(mixed.firingCount()).isEqualTo(1);
            assertThat(mixed.resolvedCount()).isEqualTo(1);
            assertThat(mixed.getAlertPageURL()).contains("alertState=firing");

            NotificationGroup allResolved = groups.build(NotifyContext.background(), List.of(resolved));
            assertThat(allResolved.getStatus()).isEqualTo("resolved");
            assertThat(allResolved.getAlerts().getResolved()).hasSize(1);
        }
    }

    @Test
    @DisplayName("分组标签来自上下文")
    void groupLabelsFromContext() {
        NotifyContext ctx = NotifyContext.background().withGroupLabels(Map.of("alertname", "AlwaysFiring"));

        NotificationGroup g = groups.build(ctx, List.of(alert("AlwaysFiring", "warning")));

        assertThat(g.getGroupLabels().asMap()).containsExactly(Map.entry("alertname", "AlwaysFiring"));
    }

    @Test
    void dataKeys() {
        NotificationGroup g = groups.build(NotifyContext.background(), List.of(alert("AlwaysFiring", "warning")));

        assertThat(g.toData("t", "m")).containsOnlyKeys("Title", "Message", "Status", "Alerts", "GroupLabels",
                "CommonLabels", "CommonAnnotations", "ExternalURL", "RuleUrl", "AlertPageUrl");
        assertThat(g.toData("t", null)).doesNotContainKey("Message");
    }
}
