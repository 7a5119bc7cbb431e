package com.nova.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义缓存键、意图标签等跨模块共享的常量。
 * </p>
 *
 * @author nova
 * @since 2026-10-18
 */
public class Constants {

    /** 缓存键分隔符，如 events:2026-10-18 */
    public final static String CACHE_KEY_SEPARATOR = ":";

    /** 模型输出中表示“无具体领域”的标签 */
    public final static String GENERAL_LABEL = "general";

}
