package com.selectai.domain.agent.model.entity;

import com.selectai.domain.agent.model.valobj.AgentAttributes;
import com.selectai.domain.common.model.entity.AgentObjectEntity;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Agent 领域实体
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AgentEntity extends AgentObjectEntity<AgentAttributes> {

    public AgentEntity() {
    }

    public AgentEntity(String name, String description, AgentAttributes attributes) {
        super(name, description, attributes);
    }

    @Override
    public AgentObjectTypeEnum getObjectType() {
        return AgentObjectTypeEnum.AGENT;
    }
}
