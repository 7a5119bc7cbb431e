/**
 * Context 领域 - 提示词上下文组装
 *
 * <p>职责：把人设前言、对话窗口与按意图选中的领域数据组装成一次模型调用的上下文。</p>
 *
 * <h3>核心规则</h3>
 * <ul>
 *   <li>只包含置信度达到接受阈值的意图对应的领域</li>
 *   <li>识别到 REFRESH 时本次请求强制刷新所有选中领域</li>
 *   <li>单个领域失败只影响自身，以内联说明替代；存储故障直接抛出</li>
 * </ul>
 *
 * @author nova
 * @since 2026-10-18
 */
package com.nova.domain.context;
