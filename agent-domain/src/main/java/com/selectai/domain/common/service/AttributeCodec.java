package com.selectai.domain.common.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.domain.common.model.valobj.AttributeField;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.common.Constants;
import com.selectai.types.enums.ResponseCode;
import com.selectai.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 属性记录编解码。
 * <p>
 * 属性记录 ↔ 属性 Map 的转换由 Jackson 完成（字段名为蛇形，空值不输出）；
 * 属性视图中的字符串值按 {@link AttributeSchema} 中声明的类型解析，不做按值猜测。
 * </p>
 */
@Slf4j
@Service
public class AttributeCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public AttributeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 属性记录转为属性 Map，null 记录得到空 Map。
     */
    public Map<String, Object> encode(AgentObjectAttributes attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (attributes == null) {
            return result;
        }
        Map<String, Object> converted = objectMapper.convertValue(attributes, MAP_REF);
        if (converted != null) {
            converted.forEach((key, value) -> {
                if (value != null) {
                    result.put(key, value);
                }
            });
        }
        return result;
    }

    /**
     * 属性 Map 转为属性记录。
     */
    public <A extends AgentObjectAttributes> A fromMap(Map<String, Object> attributes, Class<A> type) {
        try {
            return objectMapper.convertValue(attributes == null ? new LinkedHashMap<>() : attributes, type);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Failed to convert attributes to " + type.getSimpleName(), ex);
        }
    }

    /**
     * 属性视图的原始值按属性表解析为属性记录。属性表之外的属性不进入记录，
     * 由 {@link #unmapped(AttributeSchema, Map)} 单独取出。
     */
    public <A extends AgentObjectAttributes> A decode(AttributeSchema schema, Map<String, String> raw, Class<A> type) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<String, String> entry : raw.entrySet()) {
                String key = normalizeName(entry.getKey());
                AttributeField field = schema.field(key);
                if (field == null) {
                    continue;
                }
                if (entry.getValue() == null) {
                    continue;
                }
                values.put(key, parseValue(field, entry.getValue()));
            }
        }
        return fromMap(values, type);
    }

    /**
     * 属性视图中属性表未登记的属性，保留原始字符串值。
     */
    public Map<String, String> unmapped(AttributeSchema schema, Map<String, String> raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw == null) {
            return result;
        }
        raw.forEach((name, value) -> {
            String key = normalizeName(name);
            if (schema.field(key) == null) {
                result.put(key, value);
            }
        });
        if (!result.isEmpty()) {
            log.warn("Attributes unknown to {} schema kept as raw values. keys={}", schema.getObjectType(), result.keySet());
        }
        return result;
    }

    /**
     * 调用方传入的单个属性值归一为 Map/List/标量形式，枚举转为其编码。
     */
    public Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        return objectMapper.convertValue(value, Object.class);
    }

    public String normalizeName(String attributeName) {
        return attributeName == null ? null : attributeName.trim().toLowerCase(Locale.ROOT);
    }

    private Object parseValue(AttributeField field, String raw) {
        switch (field.getType()) {
            case BOOLEAN:
                return parseBoolean(field, raw);
            case INTEGER:
                return Long.valueOf(raw.trim());
            case NUMBER:
                return new BigDecimal(raw.trim());
            case STRING_LIST:
                if (!raw.trim().startsWith("[")) {
                    // 逗号分隔的旧格式
                    return Arrays.stream(raw.split(Constants.SPLIT))
                            .map(String::trim)
                            .filter(StringUtils::isNotEmpty)
                            .collect(Collectors.toList());
                }
                return readJson(field, raw);
            case OBJECT:
            case OBJECT_LIST:
                return readJson(field, raw);
            case STRING:
            default:
                return raw;
        }
    }

    private Boolean parseBoolean(AttributeField field, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (List.of("true", "yes", "y", "1", "on").contains(value)) {
            return Boolean.TRUE;
        }
        if (List.of("false", "no", "n", "0", "off").contains(value)) {
            return Boolean.FALSE;
        }
        throw new AppException(ResponseCode.UN_ERROR.getCode(),
                "Attribute '" + field.getName() + "' is not a boolean: " + raw);
    }

    private Object readJson(AttributeField field, String raw) {
        try {
            return objectMapper.readValue(raw, Object.class);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Attribute '" + field.getName() + "' is not valid json", ex);
        }
    }
}
