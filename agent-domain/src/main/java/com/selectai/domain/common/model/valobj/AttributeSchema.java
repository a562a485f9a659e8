package com.selectai.domain.common.model.valobj;

import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.AttributeTypeEnum;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对象类型的属性表：字段名 → {类型, 是否必填, 允许值}。
 * <p>
 * 字段名即数据库侧的属性名（小写蛇形）。
 * </p>
 */
public final class AttributeSchema {

    private final AgentObjectTypeEnum objectType;

    private final Map<String, AttributeField> fields;

    private AttributeSchema(AgentObjectTypeEnum objectType, Map<String, AttributeField> fields) {
        this.objectType = objectType;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(AgentObjectTypeEnum objectType) {
        return new Builder(objectType);
    }

    public AgentObjectTypeEnum getObjectType() {
        return objectType;
    }

    public AttributeField field(String name) {
        return name == null ? null : fields.get(name);
    }

    public boolean contains(String name) {
        return field(name) != null;
    }

    public Collection<AttributeField> fields() {
        return fields.values();
    }

    public static final class Builder {

        private final AgentObjectTypeEnum objectType;
        private final Map<String, AttributeField> fields = new LinkedHashMap<>();

        private Builder(AgentObjectTypeEnum objectType) {
            this.objectType = objectType;
        }

        public Builder required(String name, AttributeTypeEnum type, String... allowedValues) {
            fields.put(name, AttributeField.of(name, type, true, allowedValues));
            return this;
        }

        public Builder optional(String name, AttributeTypeEnum type, String... allowedValues) {
            fields.put(name, AttributeField.of(name, type, false, allowedValues));
            return this;
        }

        public AttributeSchema build() {
            return new AttributeSchema(objectType, new LinkedHashMap<>(fields));
        }
    }
}
