package com.nova.infrastructure.repository.cache;

import com.nova.domain.cache.adapter.repository.ICacheEntryRepository;
import com.nova.domain.cache.model.entity.CacheEntryEntity;
import com.nova.infrastructure.dao.CacheEntryDao;
import com.nova.infrastructure.dao.po.CacheEntryPO;
import com.nova.infrastructure.util.JsonCodec;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 缓存条目仓储实现类。
 * <p>
 * 数据以 JSON 文本落库，读出时还原为 Map / List / 标量；
 * 数据库访问异常统一转换为 STORE_ERROR。
 * </p>
 */
@Slf4j
@Repository
public class CacheEntryRepositoryImpl implements ICacheEntryRepository {

    private final CacheEntryDao cacheEntryDao;
    private final JsonCodec jsonCodec;

    public CacheEntryRepositoryImpl(CacheEntryDao cacheEntryDao, JsonCodec jsonCodec) {
        this.cacheEntryDao = cacheEntryDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public CacheEntryEntity findByKey(String key) {
        try {
            return toEntity(cacheEntryDao.selectByKey(key));
        } catch (DataAccessException ex) {
            throw storeError("read cache entry " + key, ex);
        }
    }

    @Override
    public CacheEntryEntity upsert(CacheEntryEntity entity) {
        entity.validate();
        CacheEntryPO po = toPO(entity);
        try {
            cacheEntryDao.upsert(po);
        } catch (DataAccessException ex) {
            throw storeError("write cache entry " + entity.getKey(), ex);
        }
        // 返回按落库文本还原的数据，命中时读到的是同一形态
        return toEntity(po);
    }

    @Override
    public List<CacheEntryEntity> findAll() {
        List<CacheEntryPO> list;
        try {
            list = cacheEntryDao.selectAll();
        } catch (DataAccessException ex) {
            throw storeError("list cache entries", ex);
        }
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public boolean deleteByKey(String key) {
        try {
            return cacheEntryDao.deleteByKey(key) > 0;
        } catch (DataAccessException ex) {
            throw storeError("delete cache entry " + key, ex);
        }
    }

    @Override
    public int deleteExpiredBefore(LocalDateTime cutoff) {
        try {
            return cacheEntryDao.deleteExpiredBefore(cutoff);
        } catch (DataAccessException ex) {
            throw storeError("purge cache entries", ex);
        }
    }

    private AppException storeError(String action, DataAccessException ex) {
        log.error("Cache store unavailable. action={}, error={}", action, ex.getMessage());
        return new AppException(ResponseCode.STORE_ERROR, "Failed to " + action, ex);
    }

    /**
     * PO 转换为 Entity
     */
    private CacheEntryEntity toEntity(CacheEntryPO po) {
        if (po == null) {
            return null;
        }
        CacheEntryEntity entity = new CacheEntryEntity();
        entity.setKey(po.getKey());
        entity.setPayload(jsonCodec.readObject(po.getData()));
        entity.setFetchedAt(po.getFetchedAt());
        entity.setExpiresAt(po.getExpiresAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private CacheEntryPO toPO(CacheEntryEntity entity) {
        return CacheEntryPO.builder()
                .key(entity.getKey())
                .data(jsonCodec.writeValue(entity.getPayload()))
                .fetchedAt(entity.getFetchedAt())
                .expiresAt(entity.getExpiresAt())
                .build();
    }
}
