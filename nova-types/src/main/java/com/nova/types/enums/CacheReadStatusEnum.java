package com.nova.types.enums;

/**
 * 缓存读取结果状态。
 * <ul>
 *   <li>HIT：命中未过期条目，未触发拉取</li>
 *   <li>FRESH：拉取成功并写回</li>
 *   <li>STALE：拉取失败，返回历史条目</li>
 * </ul>
 */
public enum CacheReadStatusEnum {
    HIT,
    FRESH,
    STALE
}
