package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;

/**
 * Task 不存在
 */
public class AgentTaskNotFoundException extends AgentObjectNotFoundException {

    private static final long serialVersionUID = 1L;

    public AgentTaskNotFoundException(String name) {
        super(AgentObjectTypeEnum.TASK, name);
    }

    public AgentTaskNotFoundException(String name, AgentDatabaseException cause) {
        super(AgentObjectTypeEnum.TASK, name, cause);
    }
}
