package com.fastalert.core.notify;

import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.view.ExtendedAlert;
import com.fastalert.model.view.ExtendedAlerts;
import com.fastalert.model.view.LabelSet;
import com.fastalert.model.view.NotificationGroup;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 原始告警 -> 渲染视图
 * 每次调用都新建视图, 不缓存
 */
public final class NotificationGroups {

    private final AlertLinks links;

    private final Clock clock;

    public NotificationGroups(AlertLinks links, Clock clock) {
        this.links = links;
        this.clock = clock;
    }

    public NotificationGroup build(NotifyContext ctx, List<Alert> alerts) {
        Instant now = Instant.now(clock);
        List<ExtendedAlert> extended = new ArrayList<>(alerts.size());
        List<Map<String, String>> labelSets = new ArrayList<>(alerts.size());
        List<Map<String, String>> annotationSets = new ArrayList<>(alerts.size());
        AlertStatus status = AlertStatus.RESOLVED;

        for (Alert a : alerts) {
            AlertStatus s = a.status(now);
            if (s == AlertStatus.FIRING) {
                status = AlertStatus.FIRING;
            }
            Map<String, String> annotations = displayAnnotations(a);
            extended.add(extend(a, s, annotations));
            labelSets.add(a.getLabels());
            annotationSets.add(annotations);
        }

        return NotificationGroup.builder()
                .alerts(new ExtendedAlerts(extended))
                .groupLabels(ctx.getGroupLabels())
                .commonLabels(LabelSet.of(intersect(labelSets)))
                .commonAnnotations(LabelSet.of(intersect(annotationSets)))
                .status(status.value())
                .externalURL(links.externalUrl())
                .ruleURL(links.ruleUrl())
                .alertPageURL(links.alertPageUrl(status))
                .build();
    }

    public ExtendedAlert extend(Alert a, AlertStatus status, Map<String, String> annotations) {
        return ExtendedAlert.builder()
                .status(status.value())
                .labels(LabelSet.of(a.getLabels()))
                .annotations(LabelSet.of(annotations))
                .startsAt(a.getStartsAt())
                .endsAt(a.getEndsAt())
                .generatorURL(a.getGeneratorUrl() == null ? "" : a.getGeneratorUrl())
                .fingerprint(Fingerprints.of(a.getLabels()))
                .silenceURL(links.silenceUrl(a.getLabels()))
                .dashboardURL(links.dashboardUrl(a.dashboardUid()))
                .panelURL(links.panelUrl(a.dashboardUid(), a.panelId()))
                .build();
    }

    private static Map<String, String> displayAnnotations(Alert a) {
        Map<String, String> m = new TreeMap<>();
        a.getAnnotations().forEach((k, v) -> {
            if (!Alert.isMetadataAnnotation(k)) {
                m.put(k, v);
            }
        });
        return m;
    }

    /** 所有集合中键值都相同的项 */
    private static Map<String, String> intersect(List<Map<String, String>> sets) {
        if (sets.isEmpty()) {
            return Map.of();
        }
        Map<String, String> common = new HashMap<>(sets.get(0));
        for (int i = 1; i < sets.size(); i++) {
            Map<String, String> next = sets.get(i);
            common.entrySet().removeIf(e -> !Objects.equals(next.get(e.getKey()), e.getValue()));
        }
        return common;
    }
}
