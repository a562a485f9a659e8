package com.selectai.domain.profile.service;

import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.domain.common.service.AgentObjectLifecycleService;
import com.selectai.domain.common.service.AttributeCodec;
import com.selectai.domain.common.service.AttributeDiffDomainService;
import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.domain.profile.model.entity.ProfileEntity;
import com.selectai.domain.profile.model.valobj.ProfileAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AgentObjectNotFoundException;
import com.selectai.types.exception.ProfileNotFoundException;
import org.springframework.stereotype.Service;

/**
 * AI Profile 生命周期服务 (DBMS_CLOUD_AI)。
 */
@Service
public class ProfileService extends AgentObjectLifecycleService<ProfileEntity, ProfileAttributes> {

    public ProfileService(IAgentObjectRepository agentObjectRepository,
                          AttributeCodec attributeCodec,
                          AttributeValidationDomainService attributeValidationDomainService,
                          AttributeDiffDomainService attributeDiffDomainService) {
        super(agentObjectRepository, attributeCodec, attributeValidationDomainService, attributeDiffDomainService);
    }

    @Override
    protected AgentObjectTypeEnum objectType() {
        return AgentObjectTypeEnum.PROFILE;
    }

    @Override
    protected AttributeSchema schema() {
        return ProfileAttributes.SCHEMA;
    }

    @Override
    protected Class<ProfileAttributes> attributesType() {
        return ProfileAttributes.class;
    }

    @Override
    protected ProfileEntity newEntity(String name, String description, ProfileAttributes attributes) {
        return new ProfileEntity(name, description, attributes);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name) {
        return new ProfileNotFoundException(name);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name, AgentDatabaseException cause) {
        return new ProfileNotFoundException(name, cause);
    }
}
