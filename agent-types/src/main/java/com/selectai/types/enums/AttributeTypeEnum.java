package com.selectai.types.enums;

/**
 * 属性值类型，决定属性的校验规则以及从属性视图读取时的解析方式。
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum AttributeTypeEnum {

    /** 字符串 */
    STRING,

    /** 布尔值 */
    BOOLEAN,

    /** 整数 */
    INTEGER,

    /** 数值 */
    NUMBER,

    /** 字符串数组 (JSON) */
    STRING_LIST,

    /** 对象 (JSON) */
    OBJECT,

    /** 对象数组 (JSON) */
    OBJECT_LIST
}
