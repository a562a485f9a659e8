package com.selectai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RUN_TEAM 调用参数 PO，response 为 OUT 参数
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamRunPO {

    private String teamName;

    private String userPrompt;

    /**
     * 运行参数 JSON
     */
    private String params;

    private String response;
}
