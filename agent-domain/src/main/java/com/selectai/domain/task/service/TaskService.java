package com.selectai.domain.task.service;

import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.domain.common.service.AgentObjectLifecycleService;
import com.selectai.domain.common.service.AttributeCodec;
import com.selectai.domain.common.service.AttributeDiffDomainService;
import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.domain.task.model.entity.TaskEntity;
import com.selectai.domain.task.model.valobj.TaskAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AgentObjectNotFoundException;
import com.selectai.types.exception.AgentTaskNotFoundException;
import org.springframework.stereotype.Service;

/**
 * 任务生命周期服务。
 * <p>
 * 非强制删除时，数据库不检查任务是否仍被启用。
 * </p>
 */
@Service
public class TaskService extends AgentObjectLifecycleService<TaskEntity, TaskAttributes> {

    public TaskService(IAgentObjectRepository agentObjectRepository,
                       AttributeCodec attributeCodec,
                       AttributeValidationDomainService attributeValidationDomainService,
                       AttributeDiffDomainService attributeDiffDomainService) {
        super(agentObjectRepository, attributeCodec, attributeValidationDomainService, attributeDiffDomainService);
    }

    @Override
    protected AgentObjectTypeEnum objectType() {
        return AgentObjectTypeEnum.TASK;
    }

    @Override
    protected AttributeSchema schema() {
        return TaskAttributes.SCHEMA;
    }

    @Override
    protected Class<TaskAttributes> attributesType() {
        return TaskAttributes.class;
    }

    @Override
    protected TaskEntity newEntity(String name, String description, TaskAttributes attributes) {
        return new TaskEntity(name, description, attributes);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name) {
        return new AgentTaskNotFoundException(name);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name, AgentDatabaseException cause) {
        return new AgentTaskNotFoundException(name, cause);
    }
}
