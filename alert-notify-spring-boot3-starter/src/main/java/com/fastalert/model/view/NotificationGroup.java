package com.fastalert.model.view;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一批告警的聚合视图
 */
@Getter
@Builder
@ToString
public final class NotificationGroup {

    private final ExtendedAlerts alerts;

    private final LabelSet groupLabels;

    /** 全部告警共有的标签 */
    private final LabelSet commonLabels;

    private final LabelSet commonAnnotations;

    /** 只要有一条 firing 即为 firing */
    private final String status;

    private final String externalURL;

    private final String ruleURL;

    private final String alertPageURL;

    /**
     * 模板/邮件命令使用的数据, 键名与历史模板保持一致, 不可随意修改
     *
     * @param message 为 null 时不放入 Message (用于渲染 Message 本身)
     */
    public Map<String, Object> toData(String title, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Title", title);
        if (message != null) {
            data.put("Message", message);
        }
        data.put("Status", status);
        data.put("Alerts", alerts);
        data.put("GroupLabels", groupLabels);
        data.put("CommonLabels", commonLabels);
        data.put("CommonAnnotations", commonAnnotations);
        data.put("ExternalURL", externalURL);
        data.put("RuleUrl", ruleURL);
        data.put("AlertPageUrl", alertPageURL);
        return Collections.unmodifiableMap(data);
    }

    public int firingCount() {
        return alerts.getFiring().size();
    }

    public int resolvedCount() {
        return alerts.getResolved().size();
    }
}
