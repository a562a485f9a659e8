package com.selectai.domain.agent.service;

import com.selectai.domain.agent.model.entity.AgentEntity;
import com.selectai.domain.agent.model.valobj.AgentAttributes;
import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.domain.common.service.AgentObjectLifecycleService;
import com.selectai.domain.common.service.AttributeCodec;
import com.selectai.domain.common.service.AttributeDiffDomainService;
import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AgentNotFoundException;
import com.selectai.types.exception.AgentObjectNotFoundException;
import org.springframework.stereotype.Service;

/**
 * Agent 生命周期服务
 */
@Service
public class AgentService extends AgentObjectLifecycleService<AgentEntity, AgentAttributes> {

    public AgentService(IAgentObjectRepository agentObjectRepository,
                        AttributeCodec attributeCodec,
                        AttributeValidationDomainService attributeValidationDomainService,
                        AttributeDiffDomainService attributeDiffDomainService) {
        super(agentObjectRepository, attributeCodec, attributeValidationDomainService, attributeDiffDomainService);
    }

    @Override
    protected AgentObjectTypeEnum objectType() {
        return AgentObjectTypeEnum.AGENT;
    }

    @Override
    protected AttributeSchema schema() {
        return AgentAttributes.SCHEMA;
    }

    @Override
    protected Class<AgentAttributes> attributesType() {
        return AgentAttributes.class;
    }

    @Override
    protected AgentEntity newEntity(String name, String description, AgentAttributes attributes) {
        return new AgentEntity(name, description, attributes);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name) {
        return new AgentNotFoundException(name);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name, AgentDatabaseException cause) {
        return new AgentNotFoundException(name, cause);
    }
}
