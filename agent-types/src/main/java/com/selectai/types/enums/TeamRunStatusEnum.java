package com.selectai.types.enums;

/**
 * Team 运行结果状态
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum TeamRunStatusEnum {

    /**
     * 已给出最终回答
     */
    FINAL_ANSWER,

    /**
     * 等待人工输入，需在同一 conversation_id 下继续 run
     */
    HUMAN_INPUT_REQUIRED
}
