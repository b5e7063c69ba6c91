package com.fastalert.model.view;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 渲染用的单条告警视图
 * 属性名即模板中的字段名: Status / Labels / Annotations / StartsAt / EndsAt / GeneratorURL /
 * Fingerprint / SilenceURL / DashboardURL / PanelURL
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public final class ExtendedAlert {

    private final String status;

    private final LabelSet labels;

    /** 已去除 __dashboardUid__ / __panelId__ */
    private final LabelSet annotations;

    private final Instant startsAt;

    /** firing 告警可能为空 */
    private final Instant endsAt;

    /** 告警来源链接, 可能为空 */
    private final String generatorURL;

    private final String fingerprint;

    private final String silenceURL;

    private final String dashboardURL;

    private final String panelURL;
}
