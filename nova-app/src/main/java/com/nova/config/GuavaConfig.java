package com.nova.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.nova.types.enums.IntentTypeEnum;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

/**
 * Guava 缓存配置类。
 * <p>
 * 意图查询缓存：以归一化后的用户输入为键，保存模型识别结果，避免重复调用模型。
 * </p>
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "intentQueryCache")
    public Cache<String, Map<IntentTypeEnum, Double>> intentQueryCache(
            @Value("${nova.intent.query-cache.max-size:500}") long maxSize,
            @Value("${nova.intent.query-cache.expire-after-write:6h}") Duration expireAfterWrite) {
        return CacheBuilder.newBuilder()
                .maximumSize(Math.max(maxSize, 1L))
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

}
