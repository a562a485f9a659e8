package com.selectai.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Team 成员的编排方式
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum TeamProcessEnum {

    /**
     * 按 agents 列表顺序依次执行
     */
    SEQUENTIAL("sequential");

    private final String code;

    TeamProcessEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static TeamProcessEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TeamProcessEnum process : TeamProcessEnum.values()) {
            if (process.code.equalsIgnoreCase(code)) {
                return process;
            }
        }
        throw new IllegalArgumentException("Unknown team process code: " + code);
    }
}
