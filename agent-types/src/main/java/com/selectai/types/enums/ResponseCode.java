package com.selectai.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义客户端异常的响应码和对应描述信息。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 对象不存在 */
    NOT_FOUND("0003", "对象不存在"),

    /** 数据库执行失败 */
    DATABASE_ERROR("0004", "数据库执行失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
