package com.nova.types.enums;

import lombok.Getter;

/**
 * 用户意图类型枚举。
 * <p>
 * 同一句话可同时命中多个意图；UNKNOWN 表示未识别到任何数据领域。
 * 声明顺序即同分时的排序顺序。
 * </p>
 */
@Getter
public enum IntentTypeEnum {

    /** 天气 */
    WEATHER("weather"),

    /** 日程事件 */
    EVENTS("events"),

    /** 待办事项 */
    TODOS("todos"),

    /** 显式刷新 */
    REFRESH("refresh"),

    /** 未识别 */
    UNKNOWN("unknown");

    private final String label;

    IntentTypeEnum(String label) {
        this.label = label;
    }

    /**
     * 按标签解析意图，大小写不敏感。
     *
     * @param label 意图标签
     * @return 对应意图；无法识别时返回 null
     */
    public static IntentTypeEnum fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim();
        for (IntentTypeEnum intent : values()) {
            if (intent.label.equalsIgnoreCase(normalized)) {
                return intent;
            }
        }
        return null;
    }

    public boolean isDomain() {
        return this == WEATHER || this == EVENTS || this == TODOS;
    }
}
