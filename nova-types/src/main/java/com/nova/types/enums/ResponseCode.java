package com.nova.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义核心层对外暴露的错误码，上层按错误码决定降级或透传。
 * </p>
 *
 * @author nova
 * @since 2026-10-18
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 领域数据拉取失败且无历史数据可回退 */
    FETCH_ERROR("0101", "数据拉取失败"),

    /** 持久化存储不可用 */
    STORE_ERROR("0102", "存储不可用"),

    /** 模型意图识别失败 */
    CLASSIFICATION_ERROR("0103", "意图识别失败"),

    /** 文本补全服务调用失败 */
    COMPLETION_ERROR("0104", "补全服务调用失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
