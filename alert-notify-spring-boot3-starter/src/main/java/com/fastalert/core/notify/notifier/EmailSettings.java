package com.fastalert.core.notify.notifier;

import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.NotificationChannelConfig;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * email 渠道配置
 * addresses: 分号分隔, 必填; message: 可选模板; singleEmail: 可选, 默认 false
 */
@Getter
@ToString
public final class EmailSettings {

    private final List<String> addresses;

    private final String message;

    private final boolean singleEmail;

    private EmailSettings(List<String> addresses, String message, boolean singleEmail) {
        this.addresses = List.copyOf(addresses);
        this.message = message;
        this.singleEmail = singleEmail;
    }

    public static EmailSettings from(NotificationChannelConfig config) {
        List<String> addresses = splitAddresses(config.getString("addresses"));
        if (addresses.isEmpty()) {
            throw new AlertConfigurationException("could not find addresses in settings of channel '" + config.getName() + "'");
        }
        return new EmailSettings(addresses, config.getString("message"), config.getBoolean("singleEmail", false));
    }

    /** 按 ; 或换行拆分, 去空白, 丢弃空项, 保持顺序不去重 */
    static List<String> splitAddresses(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String part : raw.split("[;\\n]")) {
            String s = part.trim();
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }
}
