package com.nova.domain.cache.service;

import com.nova.domain.cache.adapter.gateway.IDataFetcher;
import com.nova.domain.cache.adapter.repository.ICacheEntryRepository;
import com.nova.domain.cache.model.entity.CacheEntryEntity;
import com.nova.domain.cache.model.valobj.CacheEntryStatus;
import com.nova.domain.cache.model.valobj.CachedPayload;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 数据新鲜度缓存领域服务。
 * <p>
 * 读路径：未强制刷新且条目未过期 → 直接返回；否则调用 fetcher。
 * fetcher 成功 → 覆盖写入并返回写入后的条目；拉取或序列化失败 → 有历史条目则返回 STALE，否则抛出 FETCH_ERROR。
 * 存储故障（STORE_ERROR）直接抛出。
 * 同一键并发未命中时不做合并，可能重复拉取，后写者胜。
 * </p>
 */
@Slf4j
@Service
public class FreshnessCacheDomainService {

    private final ICacheEntryRepository cacheEntryRepository;
    private final Clock clock;

    private final Counter hitCounter;
    private final Counter fetchCounter;
    private final Counter staleCounter;
    private final Counter fetchErrorCounter;

    public FreshnessCacheDomainService(ICacheEntryRepository cacheEntryRepository, Clock clock) {
        this.cacheEntryRepository = cacheEntryRepository;
        this.clock = clock;
        this.hitCounter = Counter.builder("nova.cache.hit.total").register(Metrics.globalRegistry);
        this.fetchCounter = Counter.builder("nova.cache.fetch.total").register(Metrics.globalRegistry);
        this.staleCounter = Counter.builder("nova.cache.stale.total").register(Metrics.globalRegistry);
        this.fetchErrorCounter = Counter.builder("nova.cache.fetch_error.total").register(Metrics.globalRegistry);
    }

    public CachedPayload get(String key, Duration ttl, IDataFetcher fetcher, boolean forceRefresh) {
        String normalizedKey = requireKey(key);
        requireTtl(ttl);
        if (fetcher == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "fetcher 不能为空");
        }

        CacheEntryEntity existing = cacheEntryRepository.findByKey(normalizedKey);
        boolean expired = existing != null && existing.isExpired(LocalDateTime.now(clock));
        if (!forceRefresh && existing != null && !expired) {
            hitCounter.increment();
            log.debug("Cache hit. key={}", normalizedKey);
            return CachedPayload.hit(existing);
        }

        log.info("Fetching fresh data. key={}, forceRefresh={}, cached={}, expired={}",
                normalizedKey, forceRefresh, existing != null, expired);
        Object payload;
        try {
            payload = fetcher.fetch();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return fallback(normalizedKey, existing, ex);
        } catch (Exception ex) {
            return fallback(normalizedKey, existing, ex);
        }
        if (payload == null) {
            return fallback(normalizedKey, existing, new IllegalStateException("Fetcher returned no data"));
        }

        CacheEntryEntity stored;
        try {
            stored = cacheEntryRepository.upsert(
                    CacheEntryEntity.create(normalizedKey, payload, LocalDateTime.now(clock), ttl));
        } catch (AppException ex) {
            if (ex.is(ResponseCode.STORE_ERROR)) {
                throw ex;
            }
            log.warn("Fetched data could not be stored. key={}, code={}, info={}",
                    normalizedKey, ex.getCode(), ex.getInfo());
            return fallback(normalizedKey, existing, ex);
        }
        fetchCounter.increment();
        log.debug("Cached entry. key={}, expiresAt={}", normalizedKey, stored.getExpiresAt());
        return CachedPayload.fresh(stored);
    }

    /**
     * 只读不拉取。
     *
     * @param includeStale 为 true 时也返回已过期条目
     * @return 条目数据；不存在或已过期（且不含过期）时返回 null
     */
    public CachedPayload peek(String key, boolean includeStale) {
        CacheEntryEntity entry = cacheEntryRepository.findByKey(requireKey(key));
        if (entry == null) {
            return null;
        }
        if (!entry.isExpired(LocalDateTime.now(clock))) {
            return CachedPayload.hit(entry);
        }
        return includeStale ? CachedPayload.stale(entry) : null;
    }

    public CachedPayload put(String key, Object payload, Duration ttl) {
        String normalizedKey = requireKey(key);
        requireTtl(ttl);
        if (payload == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "payload 不能为空");
        }
        CacheEntryEntity stored = cacheEntryRepository.upsert(
                CacheEntryEntity.create(normalizedKey, payload, LocalDateTime.now(clock), ttl));
        log.debug("Set cache entry. key={}, ttl={}", normalizedKey, ttl);
        return CachedPayload.fresh(stored);
    }

    public boolean invalidate(String key) {
        String normalizedKey = requireKey(key);
        boolean removed = cacheEntryRepository.deleteByKey(normalizedKey);
        if (removed) {
            log.info("Invalidated cache entry. key={}", normalizedKey);
        }
        return removed;
    }

    public List<CacheEntryStatus> status() {
        List<CacheEntryEntity> entries = cacheEntryRepository.findAll();
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return entries.stream()
                .map(entry -> new CacheEntryStatus(entry.getKey(),
                        entry.getFetchedAt(),
                        entry.getExpiresAt(),
                        entry.isExpired(now),
                        entry.remainingSeconds(now)))
                .collect(Collectors.toList());
    }

    /**
     * 外部维护入口：删除 expiresAt 早于 cutoff 的条目。
     */
    public int purgeExpiredBefore(LocalDateTime cutoff) {
        if (cutoff == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "cutoff 不能为空");
        }
        int removed = cacheEntryRepository.deleteExpiredBefore(cutoff);
        if (removed > 0) {
            log.info("Purged expired cache entries. cutoff={}, removed={}", cutoff, removed);
        }
        return removed;
    }

    private CachedPayload fallback(String key, CacheEntryEntity existing, Exception cause) {
        if (existing != null) {
            staleCounter.increment();
            log.warn("Fetch failed, returning stale data. key={}, fetchedAt={}, error={}",
                    key, existing.getFetchedAt(), cause.getMessage());
            return CachedPayload.stale(existing);
        }
        fetchErrorCounter.increment();
        log.error("Fetch failed and no fallback data. key={}, error={}", key, cause.getMessage());
        throw new AppException(ResponseCode.FETCH_ERROR,
                "Failed to fetch data for key " + key + ": " + cause.getMessage(), cause);
    }

    private String requireKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "key 不能为空");
        }
        return key.trim();
    }

    private void requireTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "ttl 必须为正时长");
        }
    }
}
