package com.nova.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON 编解码工具。
 */
@Component
public class JsonCodec {

    private static final TypeReference<Object> OBJECT_REF = new TypeReference<Object>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取任意 JSON 值：对象为 Map，数组为 List，其余为标量。
     */
    public Object readObject(String json) {
        return readValue(json, OBJECT_REF);
    }

    /**
     * 读取 JSON 为指定类型。
     */
    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to parse json", ex);
        }
    }

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to write json", ex);
        }
    }
}
