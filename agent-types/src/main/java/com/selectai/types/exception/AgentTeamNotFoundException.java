package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;

/**
 * Team 不存在
 */
public class AgentTeamNotFoundException extends AgentObjectNotFoundException {

    private static final long serialVersionUID = 1L;

    public AgentTeamNotFoundException(String name) {
        super(AgentObjectTypeEnum.TEAM, name);
    }

    public AgentTeamNotFoundException(String name, AgentDatabaseException cause) {
        super(AgentObjectTypeEnum.TEAM, name, cause);
    }
}
