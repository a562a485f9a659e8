package com.selectai.domain.team.model.entity;

import com.selectai.domain.common.model.entity.AgentObjectEntity;
import com.selectai.domain.team.model.valobj.TeamAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Team 领域实体
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TeamEntity extends AgentObjectEntity<TeamAttributes> {

    public TeamEntity() {
    }

    public TeamEntity(String name, String description, TeamAttributes attributes) {
        super(name, description, attributes);
    }

    @Override
    public AgentObjectTypeEnum getObjectType() {
        return AgentObjectTypeEnum.TEAM;
    }
}
