package com.nova.config;

import com.nova.domain.context.model.valobj.PersonaProfile;
import com.nova.domain.intent.model.valobj.IntentPatternTable;
import com.nova.domain.intent.service.KeywordIntentClassifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 核心组件配置类：时钟、人设与关键词规则表。
 */
@Configuration
@EnableConfigurationProperties(PersonaProperties.class)
public class AssistantCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PersonaProfile personaProfile(PersonaProperties properties) {
        return new PersonaProfile(properties.getName(), properties.getPreamble());
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentPatternTable intentPatternTable() {
        return IntentPatternTable.defaults();
    }
}
