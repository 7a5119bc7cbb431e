/**
 * Cache 领域 - 数据新鲜度缓存域
 *
 * <p>职责：为慢速、不稳定的外部数据源提供持久化的 TTL 缓存，拉取失败时回退到历史数据。</p>
 *
 * <h3>核心规则</h3>
 * <ul>
 *   <li>每个键只保留一行，新拉取覆盖旧行（后写者胜）</li>
 *   <li>expiresAt 总是晚于 fetchedAt</li>
 *   <li>拉取失败且存在历史条目时返回历史数据并标记 STALE</li>
 *   <li>TTL 由调用方按领域传入，缓存本身与领域无关</li>
 * </ul>
 *
 * @author nova
 * @since 2026-10-18
 */
package com.nova.domain.cache;
