package com.selectai.domain.common.service;

import com.selectai.domain.common.model.valobj.AttributeField;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.exception.AttributeValidationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;

/**
 * 属性校验领域服务：按属性表校验整份属性记录或单个属性。
 * <p>
 * 输入为 {@link AttributeCodec} 输出的 Map 形式。校验失败即抛出，调用方据此保证不发起远程调用。
 * </p>
 */
@Service
public class AttributeValidationDomainService {

    /**
     * 校验整份属性记录：未知属性、缺失的必填属性、类型与允许值。
     */
    public void validateRecord(AttributeSchema schema, Map<String, Object> attributes) {
        for (String name : attributes.keySet()) {
            if (!schema.contains(name)) {
                throw reject(schema, name, "Unknown attribute '" + name + "'");
            }
        }
        for (AttributeField field : schema.fields()) {
            Object value = attributes.get(field.getName());
            if (value == null) {
                if (field.isRequired()) {
                    throw reject(schema, field.getName(), "Attribute '" + field.getName() + "' is required");
                }
                continue;
            }
            checkValue(schema, field, value);
        }
    }

    /**
     * 校验单个属性：属性名必须在属性表中，值不能为 null 或空串。
     */
    public void validateAttribute(AttributeSchema schema, String name, Object value) {
        AttributeField field = schema.field(name);
        if (field == null) {
            throw reject(schema, name, "Unknown attribute '" + name + "'");
        }
        if (value == null) {
            throw reject(schema, name, "Attribute '" + name + "' cannot be null");
        }
        checkValue(schema, field, value);
    }

    private void checkValue(AttributeSchema schema, AttributeField field, Object value) {
        String name = field.getName();
        switch (field.getType()) {
            case STRING:
                if (!(value instanceof String)) {
                    throw reject(schema, name, "Attribute '" + name + "' must be a string");
                }
                if (StringUtils.isBlank((String) value)) {
                    throw reject(schema, name, "Attribute '" + name + "' cannot be empty");
                }
                if (!field.allows((String) value)) {
                    throw reject(schema, name, "Attribute '" + name + "' has invalid value '" + value
                            + "', allowed: " + field.getAllowedValues());
                }
                break;
            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    throw reject(schema, name, "Attribute '" + name + "' must be a boolean");
                }
                break;
            case INTEGER:
                if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
                    throw reject(schema, name, "Attribute '" + name + "' must be an integer");
                }
                break;
            case NUMBER:
                if (!(value instanceof Number)) {
                    throw reject(schema, name, "Attribute '" + name + "' must be a number");
                }
                break;
            case STRING_LIST:
                checkCollection(schema, field, value);
                for (Object item : (Collection<?>) value) {
                    if (!(item instanceof String) || StringUtils.isBlank((String) item)) {
                        throw reject(schema, name, "Attribute '" + name + "' must contain non-empty strings");
                    }
                }
                break;
            case OBJECT:
                if (!(value instanceof Map)) {
                    throw reject(schema, name, "Attribute '" + name + "' must be an object");
                }
                break;
            case OBJECT_LIST:
                checkCollection(schema, field, value);
                for (Object item : (Collection<?>) value) {
                    if (!(item instanceof Map)) {
                        throw reject(schema, name, "Attribute '" + name + "' must contain objects");
                    }
                }
                break;
            default:
                break;
        }
    }

    private void checkCollection(AttributeSchema schema, AttributeField field, Object value) {
        if (!(value instanceof Collection)) {
            throw reject(schema, field.getName(), "Attribute '" + field.getName() + "' must be a list");
        }
        if (field.isRequired() && ((Collection<?>) value).isEmpty()) {
            throw reject(schema, field.getName(), "Attribute '" + field.getName() + "' cannot be empty");
        }
    }

    private AttributeValidationException reject(AttributeSchema schema, String name, String message) {
        return new AttributeValidationException(schema.getObjectType(), name,
                schema.getObjectType().getDisplayName() + ": " + message);
    }
}
