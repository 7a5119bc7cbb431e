package com.nova.domain.context.model.valobj;

import com.nova.domain.cache.adapter.gateway.IDataFetcher;
import com.nova.types.common.Constants;
import com.nova.types.enums.IntentTypeEnum;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;

/**
 * 一个可被意图选中的领域数据源。
 */
@Getter
@Builder
public class DomainSource {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final String name;
    private final IntentTypeEnum intent;
    private final String title;
    private final String cacheKey;
    /** 按天分键，如 events:2026-10-18 */
    private final boolean dailyScoped;
    private final Duration ttl;
    private final IDataFetcher fetcher;
    private final Function<Object, String> summarizer;

    public String resolveKey(LocalDate today) {
        String base = cacheKey == null || cacheKey.isBlank() ? name : cacheKey;
        if (!dailyScoped) {
            return base;
        }
        return base + Constants.CACHE_KEY_SEPARATOR + today.format(DAY_FORMAT);
    }

    public String displayTitle() {
        return title == null || title.isBlank() ? name : title;
    }
}
