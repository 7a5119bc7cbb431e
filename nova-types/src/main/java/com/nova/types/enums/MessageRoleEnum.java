package com.nova.types.enums;

import lombok.Getter;

/**
 * 对话消息角色枚举。
 * <p>
 * 账本只接受用户与助手两种角色，其它取值在边界处被拒绝。
 * </p>
 */
@Getter
public enum MessageRoleEnum {
    USER("user"),
    ASSISTANT("assistant");

    private final String code;

    MessageRoleEnum(String code) {
        this.code = code;
    }

    /**
     * 按存储编码解析角色，大小写不敏感。
     *
     * @param code 角色编码
     * @return 对应角色；无法识别时返回 null
     */
    public static MessageRoleEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (MessageRoleEnum role : values()) {
            if (role.code.equalsIgnoreCase(normalized) || role.name().equalsIgnoreCase(normalized)) {
                return role;
            }
        }
        return null;
    }
}
