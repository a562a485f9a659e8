package com.selectai.infrastructure.dao.po;

import com.selectai.types.enums.AgentObjectStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对象视图行 PO (USER_CLOUD_AI_PROFILES / USER_AI_AGENT_* 等)
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentObjectPO {

    /**
     * 对象名称 (profile_name / tool_name / ...)
     */
    private String name;

    /**
     * 描述
     */
    private String description;

    /**
     * 状态，视图中为 ENABLED / DISABLED
     */
    private AgentObjectStatusEnum status;
}
