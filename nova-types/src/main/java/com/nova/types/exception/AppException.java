package com.nova.types.exception;

import com.nova.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 核心层唯一的业务异常，通过异常码区分拉取失败、存储失败、识别失败等场景。
 * </p>
 *
 * @author nova
 * @since 2026-10-18
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2841937062214760519L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    /**
     * 判断是否为指定响应码。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.nova.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
