package com.nova.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 缓存条目 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntryPO {

    /**
     * 缓存键（主键）
     */
    private String key;

    /**
     * 数据 JSON 文本
     */
    private String data;

    /**
     * 拉取时间
     */
    private LocalDateTime fetchedAt;

    /**
     * 过期时间
     */
    private LocalDateTime expiresAt;
}
