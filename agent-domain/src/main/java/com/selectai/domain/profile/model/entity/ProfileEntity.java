package com.selectai.domain.profile.model.entity;

import com.selectai.domain.common.model.entity.AgentObjectEntity;
import com.selectai.domain.profile.model.valobj.ProfileAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * AI Profile 领域实体
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ProfileEntity extends AgentObjectEntity<ProfileAttributes> {

    public ProfileEntity() {
    }

    public ProfileEntity(String name, String description, ProfileAttributes attributes) {
        super(name, description, attributes);
    }

    @Override
    public AgentObjectTypeEnum getObjectType() {
        return AgentObjectTypeEnum.PROFILE;
    }
}
