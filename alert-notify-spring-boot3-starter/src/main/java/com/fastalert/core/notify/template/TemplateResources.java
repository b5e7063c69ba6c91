package com.fastalert.core.notify.template;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 读取 classpath 下的内置模板
 */
public final class TemplateResources {

    private TemplateResources() {}

    public static String load(String path) {
        ClassLoader cl = TemplateResources.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("template resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read template resource " + path, e);
        }
    }

    public static boolean exists(String path) {
        return TemplateResources.class.getClassLoader().getResource(path) != null;
    }
}
