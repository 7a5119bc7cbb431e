/**
 * Conversation 领域 - 对话账本域
 *
 * <p>职责：按时间顺序追加对话消息，并为模型上下文提供尾部时间窗口。</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>只追加：消息写入后不修改、不删除</li>
 *   <li>时间窗口：读取方按 created_at 截取最近一段历史</li>
 *   <li>有序性：created_at 升序，同一时刻按写入顺序</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.nova.domain.conversation.model.entity.ConversationMessageEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>ConversationLedgerDomainService - 追加与窗口读取</li>
 * </ul>
 *
 * @author nova
 * @since 2026-10-18
 */
package com.nova.domain.conversation;
