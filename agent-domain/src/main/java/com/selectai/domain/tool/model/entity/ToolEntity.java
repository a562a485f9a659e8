package com.selectai.domain.tool.model.entity;

import com.selectai.domain.common.model.entity.AgentObjectEntity;
import com.selectai.domain.tool.model.valobj.ToolAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 工具领域实体
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolEntity extends AgentObjectEntity<ToolAttributes> {

    public ToolEntity() {
    }

    public ToolEntity(String name, String description, ToolAttributes attributes) {
        super(name, description, attributes);
    }

    @Override
    public AgentObjectTypeEnum getObjectType() {
        return AgentObjectTypeEnum.TOOL;
    }
}
