package com.fastalert.model;

import com.fastalert.exception.AlertConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Getter;

/**
 * 渠道配置: 名称 / 类型 / 自由格式的 settings
 */
@Getter
public final class NotificationChannelConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;

    private final String type;

    private final JsonNode settings;

    public NotificationChannelConfig(String name, String type, JsonNode settings) {
        this.name = name;
        this.type = type;
        this.settings = settings == null ? JsonNodeFactory.instance.objectNode() : settings.deepCopy();
    }

    public static NotificationChannelConfig fromJson(String name, String type, String settingsJson) {
        try {
            return new NotificationChannelConfig(name, type, MAPPER.readTree(settingsJson));
        } catch (JsonProcessingException e) {
            throw new AlertConfigurationException("could not parse settings of channel " + name, e);
        }
    }

    /** 缺失或非文本返回空串 */
    public String getString(String key) {
        JsonNode node = settings.get(key);
        return node == null || node.isNull() ? "" : node.asText("");
    }

    public boolean getBoolean(String key, boolean def) {
        JsonNode node = settings.get(key);
        return node == null || node.isNull() ? def : node.asBoolean(def);
    }
}
