package com.selectai.infrastructure.dao;

import com.selectai.infrastructure.dao.po.TeamRunPO;
import org.apache.ibatis.annotations.Mapper;

/**
 * Team 运行 DAO
 *
 * @author selectai
 * @since 2025-06-10
 */
@Mapper
public interface AgentTeamDao {

    /**
     * DBMS_CLOUD_AI_AGENT.RUN_TEAM，结果写回 po.response
     */
    void runTeam(TeamRunPO po);
}
