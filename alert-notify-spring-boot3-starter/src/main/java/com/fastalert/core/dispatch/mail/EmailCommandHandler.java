package com.fastalert.core.dispatch.mail;

import com.fastalert.core.spi.dispatch.CommandHandler;
import com.fastalert.core.spi.mail.MailTransport;
import com.fastalert.model.command.SendEmailCommand;
import com.fastalert.model.mail.EmailMessage;

import java.util.List;
import java.util.Map;

/**
 * 处理 SendEmailCommand: 按布局渲染正文后交给 MailTransport
 * singleEmail=false 时每个收件人单独一封
 */
public class EmailCommandHandler implements CommandHandler<SendEmailCommand> {

    private final MailLayoutRenderer renderer;

    private final MailTransport transport;

    private final String from;

    private final List<String> contentTypes;

    public EmailCommandHandler(MailLayoutRenderer renderer, MailTransport transport,
                               String fromName, String fromAddress, List<String> contentTypes) {
        MailLayoutRenderer.checkContentTypes(contentTypes);
        this.renderer = renderer;
        this.transport = transport;
        this.from = "\"" + fromName + "\" <" + fromAddress + ">";
        this.contentTypes = List.copyOf(contentTypes);
    }

    @Override
    public Class<SendEmailCommand> commandType() {
        return SendEmailCommand.class;
    }

    @Override
    public void handle(SendEmailCommand cmd) throws Exception {
        Map<String, String> body = renderer.render(cmd.getTemplate(), cmd.getData(), contentTypes);
        if (cmd.isSingleEmail()) {
            transport.send(message(cmd, cmd.getTo(), body));
            return;
        }
        for (String to : cmd.getTo()) {
            transport.send(message(cmd, List.of(to), body));
        }
    }

    private EmailMessage message(SendEmailCommand cmd, List<String> to, Map<String, String> body) {
        return EmailMessage.builder()
                .from(from)
                .to(to)
                .subject(cmd.getSubject())
                .body(body)
                .build();
    }

    public String getFrom() {
        return from;
    }
}
