package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;

/**
 * Agent 不存在
 */
public class AgentNotFoundException extends AgentObjectNotFoundException {

    private static final long serialVersionUID = 1L;

    public AgentNotFoundException(String name) {
        super(AgentObjectTypeEnum.AGENT, name);
    }

    public AgentNotFoundException(String name, AgentDatabaseException cause) {
        super(AgentObjectTypeEnum.AGENT, name, cause);
    }
}
