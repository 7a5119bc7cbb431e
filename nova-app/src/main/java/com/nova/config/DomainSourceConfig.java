package com.nova.config;

import com.nova.domain.context.adapter.repository.IDomainSourceRegistry;
import com.nova.domain.context.model.valobj.DomainSource;
import com.nova.infrastructure.fetcher.HttpJsonDataFetcher;
import com.nova.infrastructure.source.DomainSourceRegistryImpl;
import com.nova.infrastructure.summary.DomainSummarizers;
import com.nova.infrastructure.util.JsonCodec;
import com.nova.types.enums.IntentTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 领域数据源装配：按 nova.sources.items 构建 HTTP 拉取器与对应意图的摘要器并注册。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DomainSourceProperties.class)
public class DomainSourceConfig {

    @Bean(name = "domainSourceRestClient")
    public RestClient domainSourceRestClient(DomainSourceProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return RestClient.builder().requestFactory(requestFactory).build();
    }

    @Bean
    public IDomainSourceRegistry domainSourceRegistry(DomainSourceProperties properties,
                                                      RestClient domainSourceRestClient,
                                                      JsonCodec jsonCodec,
                                                      Clock clock) {
        List<DomainSource> sources = new ArrayList<>();
        for (Map.Entry<String, DomainSourceProperties.Source> entry : properties.getItems().entrySet()) {
            String name = entry.getKey();
            DomainSourceProperties.Source source = entry.getValue();
            if (!source.isEnabled()) {
                continue;
            }
            IntentTypeEnum intent = IntentTypeEnum.fromLabel(source.getIntent());
            if (intent == null || !intent.isDomain()) {
                log.warn("Skip domain source with unsupported intent. name={}, intent={}", name, source.getIntent());
                continue;
            }
            if (StringUtils.isBlank(source.getUrl())) {
                log.warn("Skip domain source without url. name={}", name);
                continue;
            }
            sources.add(DomainSource.builder()
                    .name(name)
                    .intent(intent)
                    .title(StringUtils.defaultIfBlank(source.getTitle(), StringUtils.capitalize(name)))
                    .cacheKey(StringUtils.defaultIfBlank(source.getCacheKey(), name))
                    .dailyScoped(source.isDailyScoped())
                    .ttl(source.getTtl())
                    .fetcher(new HttpJsonDataFetcher(name, domainSourceRestClient, source.getUrl(), clock))
                    .summarizer(DomainSummarizers.forIntent(intent, clock, jsonCodec, properties.getSummaryMaxLength()))
                    .build());
        }
        return new DomainSourceRegistryImpl(sources);
    }
}
