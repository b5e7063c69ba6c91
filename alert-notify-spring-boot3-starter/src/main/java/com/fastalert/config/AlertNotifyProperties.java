package com.fastalert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * alert:
 *   notify:
 *     enabled: true
 *     external-url: http://localhost:3000/
 *     smtp:
 *       from-address: admin@grafana.localhost
 *       from-name: Grafana
 *       content-types: [text/html, text/plain]
 *     dispatch:
 *       core-pool-size: 2
 *       max-pool-size: 4
 *       queue-capacity: 1000
 *       keep-alive: 60s
 *       await-termination: 10s
 */
@Data
@ConfigurationProperties(prefix = "alert.notify")
public class AlertNotifyProperties {

    /** 开关 */
    private boolean enabled = true;

    /** 外部访问地址, 用于拼接链接 */
    private String externalUrl = "http://localhost:3000/";

    private Smtp smtp = new Smtp();

    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Smtp {
        private String fromAddress = "admin@grafana.localhost";
        private String fromName = "Grafana";
        private List<String> contentTypes = new ArrayList<>(List.of("text/html", "text/plain"));
    }

    @Data
    public static class Dispatch {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 1000;
        private Duration keepAlive = Duration.ofSeconds(60);
        /** 关闭时等待在途命令 */
        private Duration awaitTermination = Duration.ofSeconds(10);
    }
}
