package com.selectai.types.enums;

/**
 * 后端错误码枚举。
 * <p>
 * 数据库侧抛出的错误在基础设施边界解码一次，映射为此枚举；
 * 未登记的错误码统一归为 {@link #UNKNOWN}，原始错误码与消息仍保留在异常中。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum OracleErrorCodeEnum {

    /**
     * 正则表达式非法 (REGEXP_LIKE)
     */
    INVALID_REGULAR_EXPRESSION(12726),

    /**
     * Agent 操作失败
     */
    AGENT_OPERATION_FAILED(20050),

    /**
     * Task 操作失败
     */
    TASK_OPERATION_FAILED(20051),

    /**
     * Team 操作失败
     */
    TEAM_OPERATION_FAILED(20053),

    /**
     * 未登记的错误码
     */
    UNKNOWN(0);

    private final int vendorCode;

    OracleErrorCodeEnum(int vendorCode) {
        this.vendorCode = vendorCode;
    }

    public int getVendorCode() {
        return vendorCode;
    }

    /**
     * ORA-NNNNN 形式的错误码。
     */
    public String getCode() {
        return formatCode(vendorCode);
    }

    public static String formatCode(int vendorCode) {
        return String.format("ORA-%05d", vendorCode);
    }

    public static OracleErrorCodeEnum fromVendorCode(int vendorCode) {
        for (OracleErrorCodeEnum value : OracleErrorCodeEnum.values()) {
            if (value != UNKNOWN && value.vendorCode == vendorCode) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
