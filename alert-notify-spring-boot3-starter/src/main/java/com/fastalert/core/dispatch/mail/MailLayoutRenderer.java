package com.fastalert.core.dispatch.mail;

import com.fastalert.core.notify.template.TemplateResources;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.exception.AlertRenderException;
import com.samskivert.mustache.Escapers;
import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;
import com.samskivert.mustache.Template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内置邮件布局渲染, templates/{layout}.html / .txt
 * html 布局输出时转义, txt 原样输出
 */
public class MailLayoutRenderer {

    public static final String TEXT_HTML = "text/html";

    public static final String TEXT_PLAIN = "text/plain";

    private static final String ROOT = "templates/";

    private static final Mustache.Escaper HTML_ESCAPER = Escapers.simple(new String[][]{
            {"&", "&amp;"},
            {"'", "&#39;"},
            {"\"", "&quot;"},
            {"<", "&lt;"},
            {">", "&gt;"}
    });

    private final Mustache.Compiler html;

    private final Mustache.Compiler text;

    /** layout.ext -> 编译结果 */
    private final Map<String, Template> cache = new ConcurrentHashMap<>();

    public MailLayoutRenderer() {
        Mustache.Compiler base = Mustache.compiler()
                .defaultValue("")
                .emptyStringIsFalse(true)
                .zeroIsFalse(true);
        this.html = base.withEscaper(HTML_ESCAPER);
        this.text = base.escapeHTML(false);
    }

    /**
     * 校验内容类型受支持
     */
    public static void checkContentTypes(List<String> contentTypes) {
        if (contentTypes == null || contentTypes.isEmpty()) {
            throw new AlertConfigurationException("at least one mail content type is required");
        }
        for (String ct : contentTypes) {
            extension(ct);
        }
    }

    /**
     * @return contentType -> 渲染结果, 顺序与入参一致
     */
    public Map<String, String> render(String layout, Map<String, Object> data, List<String> contentTypes) {
        Map<String, String> body = new LinkedHashMap<>();
        for (String ct : contentTypes) {
            Template tmpl = template(layout, ct);
            try {
                body.put(ct, tmpl.execute(data));
            } catch (MustacheException e) {
                throw new AlertRenderException("failed to render email layout " + layout + " (" + ct + "): " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableMap(body);
    }

    private Template template(String layout, String contentType) {
        String ext = extension(contentType);
        String path = ROOT + layout + "." + ext;
        return cache.computeIfAbsent(path, p -> {
            if (!TemplateResources.exists(p)) {
                throw new AlertRenderException("no such email layout \"" + layout + "\" for " + contentType, null);
            }
            Mustache.Compiler c = TEXT_HTML.equals(contentType) ? html : text;
            return c.compile(TemplateResources.load(p));
        });
    }

    private static String extension(String contentType) {
        if (TEXT_HTML.equals(contentType)) {
            return "html";
        }
        if (TEXT_PLAIN.equals(contentType)) {
            return "txt";
        }
        throw new AlertConfigurationException("unsupported mail content type: " + contentType);
    }
}
