package com.fastalert.model.command;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 发送邮件命令
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SendEmailCommand implements DeliveryCommand {

    private final String subject;

    /** 有序, 不去重 */
    private final List<String> to;

    /** true: 一封邮件发给全部收件人; false: 每个收件人单独一封 */
    private final boolean singleEmail;

    /** 内置邮件布局名 */
    private final String template;

    private final Map<String, Object> data;

    @Builder
    private SendEmailCommand(String subject, List<String> to, boolean singleEmail,
                             String template, Map<String, Object> data) {
        this.subject = subject;
        this.to = List.copyOf(to);
        this.singleEmail = singleEmail;
        this.template = template;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    public String commandName() {
        return "send_email";
    }
}
