package com.selectai.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.selectai.types.enums.ResponseCode;
import com.selectai.types.exception.AppException;
import org.springframework.stereotype.Component;

/**
 * JSON 编解码工具。
 *
 * @author selectai
 * @since 2025-06-10
 */
@Component
public class JsonCodec {

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
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
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }

    /**
     * 单个属性值转为过程参数文本：字符串原样，标量取字面值，列表与对象写为 JSON。
     */
    public String writeAttributeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Boolean || value instanceof Number) {
            return String.valueOf(value);
        }
        return writeValue(value);
    }
}
