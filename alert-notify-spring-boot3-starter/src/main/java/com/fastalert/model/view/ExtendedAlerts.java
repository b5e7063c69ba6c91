package com.fastalert.model.view;

import com.fastalert.model.enums.AlertStatus;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 有序告警列表, 保持输入顺序
 * 模板中通过 Alerts.Firing / Alerts.Resolved 取子集
 */
public final class ExtendedAlerts extends AbstractList<ExtendedAlert> {

    private final List<ExtendedAlert> alerts;

    public ExtendedAlerts(List<ExtendedAlert> alerts) {
        this.alerts = Collections.unmodifiableList(new ArrayList<>(alerts));
    }

    public static ExtendedAlerts of(ExtendedAlert... alerts) {
        return new ExtendedAlerts(List.of(alerts));
    }

    @Override
    public ExtendedAlert get(int index) {
        return alerts.get(index);
    }

    @Override
    public int size() {
        return alerts.size();
    }

    public ExtendedAlerts getFiring() {
        return withStatus(AlertStatus.FIRING);
    }

    public ExtendedAlerts getResolved() {
        return withStatus(AlertStatus.RESOLVED);
    }

    private ExtendedAlerts withStatus(AlertStatus status) {
        List<ExtendedAlert> matched = new ArrayList<>();
        for (ExtendedAlert a : alerts) {
            if (status.value().equals(a.getStatus())) {
                matched.add(a);
            }
        }
        return new ExtendedAlerts(matched);
    }
}
