package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;

/**
 * AI Profile 不存在
 */
public class ProfileNotFoundException extends AgentObjectNotFoundException {

    private static final long serialVersionUID = 1L;

    public ProfileNotFoundException(String name) {
        super(AgentObjectTypeEnum.PROFILE, name);
    }

    public ProfileNotFoundException(String name, AgentDatabaseException cause) {
        super(AgentObjectTypeEnum.PROFILE, name, cause);
    }
}
