package com.fastalert.model.mail;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 交给 MailTransport 的已渲染邮件
 */
@Getter
@Builder
@ToString(exclude = "body")
public class EmailMessage {

    private final String from;

    private final List<String> to;

    private final String subject;

    /** contentType -> 内容, 如 text/html / text/plain */
    private final Map<String, String> body;
}
