package com.selectai.types.enums;

/**
 * 对象状态枚举，由数据库维护，仅能通过 enable/disable 改变。
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum AgentObjectStatusEnum {

    ENABLED("enabled"),

    DISABLED("disabled");

    private final String code;

    AgentObjectStatusEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AgentObjectStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AgentObjectStatusEnum status : AgentObjectStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown object status code: " + code);
    }
}
