package com.nova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 助手人设配置，前缀 nova.persona；为空时使用内置的 Nova 人设。
 */
@Data
@ConfigurationProperties(prefix = "nova.persona")
public class PersonaProperties {

    private String name;

    private String preamble;
}
