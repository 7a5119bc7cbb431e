/**
 * Intent 领域 - 意图识别域
 *
 * <p>职责：判断一句用户输入涉及哪些外部数据领域（天气、日程、待办、刷新）。</p>
 *
 * <h3>识别路径</h3>
 * <ul>
 *   <li>规则快路径：关键词表匹配，置信度达到阈值直接返回</li>
 *   <li>查询缓存：归一化输入命中历史模型结果</li>
 *   <li>模型兜底：few-shot 提示调用补全服务，失败降级为 UNKNOWN</li>
 * </ul>
 *
 * @author nova
 * @since 2026-10-18
 */
package com.nova.domain.intent;
