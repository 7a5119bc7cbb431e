package com.nova.infrastructure.util;

import org.apache.commons.lang3.StringUtils;

import java.util.function.Function;

/**
 * 领域数据的默认摘要：紧凑 JSON，超长截断。
 * <p>
 * 字符串原样（去空白）输出，其他值序列化为单行 JSON。
 * </p>
 */
public class PayloadSummarizer implements Function<Object, String> {

    public static final int DEFAULT_MAX_LENGTH = 2000;

    private final JsonCodec jsonCodec;
    private final int maxLength;

    public PayloadSummarizer(JsonCodec jsonCodec) {
        this(jsonCodec, DEFAULT_MAX_LENGTH);
    }

    public PayloadSummarizer(JsonCodec jsonCodec, int maxLength) {
        this.jsonCodec = jsonCodec;
        this.maxLength = Math.max(maxLength, 16);
    }

    @Override
    public String apply(Object payload) {
        if (payload == null) {
            return null;
        }
        String text = payload instanceof CharSequence sequence
                ? StringUtils.normalizeSpace(sequence.toString())
                : jsonCodec.writeValue(payload);
        return StringUtils.abbreviate(text, maxLength);
    }
}
