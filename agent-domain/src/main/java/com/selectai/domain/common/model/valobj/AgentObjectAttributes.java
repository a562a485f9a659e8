package com.selectai.domain.common.model.valobj;

/**
 * 对象属性记录。
 * <p>
 * 每种对象类型的属性类都实现此接口，逐字段规则由对应的 {@link AttributeSchema} 描述，
 * 跨字段规则在 {@link #validate()} 中实现。
 * </p>
 */
public interface AgentObjectAttributes {

    /**
     * 跨字段校验，失败时抛出 {@link com.selectai.types.exception.AttributeValidationException}。
     */
    default void validate() {
    }
}
