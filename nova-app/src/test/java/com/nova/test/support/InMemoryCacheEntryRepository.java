package com.nova.test.support;

import com.nova.domain.cache.adapter.repository.ICacheEntryRepository;
import com.nova.domain.cache.model.entity.CacheEntryEntity;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存缓存条目仓储，可切换为存储不可用状态。
 */
public class InMemoryCacheEntryRepository implements ICacheEntryRepository {

    private final Map<String, CacheEntryEntity> store = new LinkedHashMap<>();
    private boolean unavailable;
    private int upsertCount;

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int getUpsertCount() {
        return upsertCount;
    }

    @Override
    public CacheEntryEntity findByKey(String key) {
        checkAvailable();
        CacheEntryEntity entity = store.get(key);
        return entity == null ? null : copy(entity);
    }

    @Override
    public CacheEntryEntity upsert(CacheEntryEntity entity) {
        checkAvailable();
        entity.validate();
        upsertCount++;
        store.put(entity.getKey(), copy(entity));
        return copy(entity);
    }

    @Override
    public List<CacheEntryEntity> findAll() {
        checkAvailable();
        List<CacheEntryEntity> result = new ArrayList<>();
        store.values().forEach(entity -> result.add(copy(entity)));
        return result;
    }

    @Override
    public boolean deleteByKey(String key) {
        checkAvailable();
        return store.remove(key) != null;
    }

    @Override
    public int deleteExpiredBefore(LocalDateTime cutoff) {
        checkAvailable();
        int removed = 0;
        Iterator<CacheEntryEntity> iterator = store.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getExpiresAt().isBefore(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new AppException(ResponseCode.STORE_ERROR, "store unavailable");
        }
    }

    private CacheEntryEntity copy(CacheEntryEntity source) {
        CacheEntryEntity entity = new CacheEntryEntity();
        entity.setKey(source.getKey());
        entity.setPayload(source.getPayload());
        entity.setFetchedAt(source.getFetchedAt());
        entity.setExpiresAt(source.getExpiresAt());
        return entity;
    }
}
