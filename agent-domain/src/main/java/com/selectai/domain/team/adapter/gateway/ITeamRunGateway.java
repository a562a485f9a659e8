package com.selectai.domain.team.adapter.gateway;

import java.util.Map;

/**
 * Team 运行网关 (DBMS_CLOUD_AI_AGENT.RUN_TEAM)
 */
public interface ITeamRunGateway {

    /**
     * 运行一轮对话
     *
     * @param teamName   Team 名称
     * @param userPrompt 用户输入
     * @param params     运行参数，至少包含 conversation_id
     * @return 数据库返回的文本，可能为 null
     */
    String runTeam(String teamName, String userPrompt, Map<String, Object> params);
}
