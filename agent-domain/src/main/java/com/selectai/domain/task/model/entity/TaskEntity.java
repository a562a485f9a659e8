package com.selectai.domain.task.model.entity;

import com.selectai.domain.common.model.entity.AgentObjectEntity;
import com.selectai.domain.task.model.valobj.TaskAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 任务领域实体
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TaskEntity extends AgentObjectEntity<TaskAttributes> {

    public TaskEntity() {
    }

    public TaskEntity(String name, String description, TaskAttributes attributes) {
        super(name, description, attributes);
    }

    @Override
    public AgentObjectTypeEnum getObjectType() {
        return AgentObjectTypeEnum.TASK;
    }
}
