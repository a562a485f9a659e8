package com.selectai.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 通知工具的通知渠道
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum NotificationTypeEnum {

    EMAIL("EMAIL"),

    SLACK("SLACK");

    private final String code;

    NotificationTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static NotificationTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NotificationTypeEnum type : NotificationTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type code: " + code);
    }
}
