package com.fastalert.core.notify.template;

import com.fastalert.core.spi.notify.MessageTemplate;
import com.fastalert.core.spi.notify.NotifierTemplate;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.exception.AlertRenderException;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.view.NotificationGroup;
import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;
import com.samskivert.mustache.Template;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

/**
 * 基于 Mustache 的默认模板实现
 *
 * 消息模板按纯文本渲染, 由邮件布局在写入 HTML 时统一转义
 * 内置 partial: {{> default.title}} / {{> default.message}}
 */
public class MustacheNotifierTemplate implements NotifierTemplate {

    public static final String DEFAULT_TITLE = "default.title";

    public static final String DEFAULT_MESSAGE = "default.message";

    private static final String DEFAULT_MESSAGE_RESOURCE = "templates/default_message.mustache";

    private final String defaultMessageSource;

    private final Mustache.Compiler compiler;

    private final MessageTemplate defaultMessage;

    public MustacheNotifierTemplate() {
        this.defaultMessageSource = TemplateResources.load(DEFAULT_MESSAGE_RESOURCE);
        this.compiler = Mustache.compiler()
                .escapeHTML(false)
                .defaultValue("")
                .emptyStringIsFalse(true)
                .zeroIsFalse(true)
                .withLoader(this::partial);
        this.defaultMessage = new CompiledMessage("", compiler.compile(defaultMessageSource), true);
    }

    @Override
    public MessageTemplate compile(String source) {
        if (source == null || source.isBlank()) {
            return defaultMessage;
        }
        try {
            return new CompiledMessage(source, compiler.compile(source), false);
        } catch (MustacheException e) {
            throw new AlertConfigurationException("invalid message template: " + e.getMessage(), e);
        }
    }

    /**
     * [FIRING:F] / [RESOLVED:R] / [FIRING:F, RESOLVED:R] + 分组标签值
     * 单条告警时追加 (公共标签值, alertname 在前)
     */
    @Override
    public String renderTitle(NotificationGroup group) {
        int firing = group.firingCount();
        int resolved = group.resolvedCount();

        // 空批次时与分组状态保持一致
        boolean showFiring = firing > 0;
        boolean showResolved = resolved > 0;
        if (!showFiring && !showResolved) {
            showFiring = AlertStatus.FIRING.value().equals(group.getStatus());
            showResolved = !showFiring;
        }

        StringBuilder sb = new StringBuilder("[");
        if (showFiring) {
            sb.append("FIRING:").append(firing);
        }
        if (showResolved) {
            if (showFiring) {
                sb.append(", ");
            }
            sb.append("RESOLVED:").append(resolved);
        }
        sb.append("] ");
        sb.append(String.join(" ", group.getGroupLabels().values()));
        sb.append(' ');

        if (firing + resolved == 1) {
            List<String> values = group.getCommonLabels().remove(group.getGroupLabels().names()).values();
            if (!values.isEmpty()) {
                sb.append('(').append(String.join(" ", values)).append(')');
            }
        }
        return sb.toString();
    }

    @Override
    public String renderMessage(MessageTemplate template, NotificationGroup group, String title) {
        Template compiled = template instanceof CompiledMessage
                ? ((CompiledMessage) template).template
                : ((CompiledMessage) compile(template.source())).template;
        try {
            return compiled.execute(group.toData(title, null));
        } catch (MustacheException e) {
            throw new AlertRenderException("failed to render message template: " + e.getMessage(), e);
        }
    }

    private Reader partial(String name) throws IOException {
        switch (name) {
            case DEFAULT_TITLE:
                return new StringReader("{{Title}}");
            case DEFAULT_MESSAGE:
                return new StringReader(defaultMessageSource);
            default:
                throw new FileNotFoundException("no such template \"" + name + "\"");
        }
    }

    private static final class CompiledMessage implements MessageTemplate {

        private final String source;

        private final Template template;

        private final boolean isDefault;

        private CompiledMessage(String source, Template template, boolean isDefault) {
            this.source = source;
            this.template = template;
            this.isDefault = isDefault;
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public boolean isDefault() {
            return isDefault;
        }
    }
}
