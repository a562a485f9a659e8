package com.selectai.domain.common.model.valobj;

import com.selectai.types.enums.AttributeTypeEnum;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 属性字段定义：字段名、类型、是否必填、允许值。
 */
@Getter
public final class AttributeField {

    private final String name;

    private final AttributeTypeEnum type;

    private final boolean required;

    /** 为空表示不限制取值 */
    private final Set<String> allowedValues;

    private AttributeField(String name, AttributeTypeEnum type, boolean required, Set<String> allowedValues) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.allowedValues = allowedValues;
    }

    public static AttributeField of(String name, AttributeTypeEnum type, boolean required, String... allowedValues) {
        Set<String> allowed = new LinkedHashSet<>();
        Arrays.stream(allowedValues).map(String::toLowerCase).forEach(allowed::add);
        return new AttributeField(name, type, required, Collections.unmodifiableSet(allowed));
    }

    public boolean isRestricted() {
        return !allowedValues.isEmpty();
    }

    public boolean allows(String value) {
        return !isRestricted() || (value != null && allowedValues.contains(value.toLowerCase()));
    }
}
