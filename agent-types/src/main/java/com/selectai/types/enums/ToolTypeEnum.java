package com.selectai.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工具类型枚举
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum ToolTypeEnum {

    /**
     * SQL 工具 - 通过 Profile 生成并执行 SQL
     */
    SQL("SQL"),

    /**
     * RAG 工具 - 通过 Profile 的向量索引检索
     */
    RAG("RAG"),

    /**
     * 网络搜索
     */
    WEBSEARCH("WEBSEARCH"),

    /**
     * 通知 - 邮件或 Slack
     */
    NOTIFICATION("NOTIFICATION"),

    /**
     * HTTP 端点调用
     */
    HTTP("HTTP"),

    /**
     * 人工介入
     */
    HUMAN("HUMAN");

    private final String code;

    ToolTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ToolTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ToolTypeEnum type : ToolTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tool type code: " + code);
    }
}
