package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;

/**
 * Tool 不存在
 */
public class AgentToolNotFoundException extends AgentObjectNotFoundException {

    private static final long serialVersionUID = 1L;

    public AgentToolNotFoundException(String name) {
        super(AgentObjectTypeEnum.TOOL, name);
    }

    public AgentToolNotFoundException(String name, AgentDatabaseException cause) {
        super(AgentObjectTypeEnum.TOOL, name, cause);
    }
}
