package com.fastalert.core.spi.mail;

import com.fastalert.model.mail.EmailMessage;

/**
 * 邮件传输层 (SMTP 等), 由接入方提供
 */
public interface MailTransport {

    void send(EmailMessage message) throws Exception;
}
