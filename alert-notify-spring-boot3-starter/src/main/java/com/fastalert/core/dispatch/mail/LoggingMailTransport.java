package com.fastalert.core.dispatch.mail;

import com.fastalert.core.spi.mail.MailTransport;
import com.fastalert.model.mail.EmailMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志传输, 未接入 SMTP 时默认启用
 */
public class LoggingMailTransport implements MailTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingMailTransport.class);

    @Override
    public void send(EmailMessage message) {
        log.info("[Mail] from={}, to={}, subject={}, parts={}",
                message.getFrom(), message.getTo(), message.getSubject(), message.getBody().keySet());
        if (log.isDebugEnabled()) {
            message.getBody().forEach((ct, content) -> log.debug("[Mail] {}:\n{}", ct, truncate(content)));
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
