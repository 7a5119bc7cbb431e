package com.nova.types.enums;

/**
 * 意图识别策略枚举。
 */
public enum ClassificationStrategyEnum {
    RULE_BASED,
    MODEL_BASED
}
