package com.fastalert.model;

import com.fastalert.model.enums.AlertStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 原始告警, 不可变
 */
@Getter
public final class Alert {

    /** 看板uid, 元数据注解, 不参与展示 */
    public static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";

    /** 面板id, 元数据注解, 不参与展示 */
    public static final String PANEL_ID_ANNOTATION = "__panelId__";

    private final Map<String, String> labels;

    private final Map<String, String> annotations;

    private final Instant startsAt;

    /** 为空或晚于当前时间 = firing */
    private final Instant endsAt;

    private final String generatorUrl;

    @Builder
    private Alert(@Singular Map<String, String> labels,
                  @Singular Map<String, String> annotations,
                  Instant startsAt,
                  Instant endsAt,
                  String generatorUrl) {
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.annotations = Collections.unmodifiableMap(new TreeMap<>(annotations));
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.generatorUrl = generatorUrl;
    }

    public static Alert of(Map<String, String> labels, Map<String, String> annotations) {
        return builder().labels(labels).annotations(annotations).build();
    }

    public AlertStatus status(Instant now) {
        if (endsAt != null && !endsAt.isAfter(now)) {
            return AlertStatus.RESOLVED;
        }
        return AlertStatus.FIRING;
    }

    public String dashboardUid() {
        return annotations.getOrDefault(DASHBOARD_UID_ANNOTATION, "");
    }

    public String panelId() {
        return annotations.getOrDefault(PANEL_ID_ANNOTATION, "");
    }

    public static boolean isMetadataAnnotation(String key) {
        return DASHBOARD_UID_ANNOTATION.equals(key) || PANEL_ID_ANNOTATION.equals(key);
    }

    @Override
    public String toString() {
        return "Alert{labels=" + labels + ", endsAt=" + endsAt + "}";
    }
}
