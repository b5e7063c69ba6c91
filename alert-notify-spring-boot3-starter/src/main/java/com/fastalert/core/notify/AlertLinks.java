package com.fastalert.core.notify;

import com.fastalert.model.enums.AlertStatus;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 基于外部访问地址拼接告警相关链接
 * 可选字段缺失时返回空串, 不抛异常
 */
public final class AlertLinks {

    private final String base;

    public AlertLinks(String externalUrl) {
        String u = externalUrl == null ? "" : externalUrl.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        this.base = u;
    }

    public String externalUrl() {
        return base;
    }

    /** {base}/alerting/silence/new?alertmanager=grafana&matchers=... */
    public String silenceUrl(Map<String, String> labels) {
        StringJoiner matchers = new StringJoiner(",");
        new TreeMap<>(labels).forEach((k, v) -> matchers.add(k + "=" + v));
        return base + "/alerting/silence/new?alertmanager=grafana&matchers="
                + URLEncoder.encode(matchers.toString(), StandardCharsets.UTF_8);
    }

    public String dashboardUrl(String dashboardUid) {
        if (isBlank(dashboardUid)) {
            return "";
        }
        return base + "/d/" + dashboardUid;
    }

    public String panelUrl(String dashboardUid, String panelId) {
        if (isBlank(dashboardUid) || isBlank(panelId)) {
            return "";
        }
        return dashboardUrl(dashboardUid) + "?viewPanel=" + panelId;
    }

    public String ruleUrl() {
        return base + "/alerting/list";
    }

    public String alertPageUrl(AlertStatus status) {
        return base + "/alerting/list?alertState=" + status.value() + "&view=state";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
