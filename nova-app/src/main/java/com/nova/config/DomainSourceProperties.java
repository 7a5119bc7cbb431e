package com.nova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 领域数据源配置，前缀 nova.sources。
 * <p>
 * 键为数据源名（同时作为默认缓存键），按声明顺序注册。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "nova.sources")
public class DomainSourceProperties {

    /** HTTP 连接超时 */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** HTTP 读取超时 */
    private Duration readTimeout = Duration.ofSeconds(10);

    /** 摘要最大长度 */
    private int summaryMaxLength = 2000;

    private Map<String, Source> items = new LinkedHashMap<>();

    @Data
    public static class Source {

        private boolean enabled = true;

        /** 对应意图标签：weather / events / todos */
        private String intent;

        private String title;

        /** 缓存键，缺省为数据源名 */
        private String cacheKey;

        /** URL 模板，支持 {date} */
        private String url;

        private Duration ttl = Duration.ofMinutes(5);

        /** 按天分键 */
        private boolean dailyScoped;
    }
}
