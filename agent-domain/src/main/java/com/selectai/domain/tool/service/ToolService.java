package com.selectai.domain.tool.service;

import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.domain.common.service.AgentObjectLifecycleService;
import com.selectai.domain.common.service.AttributeCodec;
import com.selectai.domain.common.service.AttributeDiffDomainService;
import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.domain.tool.model.entity.ToolEntity;
import com.selectai.domain.tool.model.valobj.ToolAttributes;
import com.selectai.domain.tool.model.valobj.ToolParams;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.NotificationTypeEnum;
import com.selectai.types.enums.ToolTypeEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AgentObjectNotFoundException;
import com.selectai.types.exception.AgentToolNotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 工具生命周期服务，另提供常用工具的快捷创建方法。
 * <p>
 * 快捷方法创建的工具均为启用状态。
 * </p>
 */
@Service
public class ToolService extends AgentObjectLifecycleService<ToolEntity, ToolAttributes> {

    public ToolService(IAgentObjectRepository agentObjectRepository,
                       AttributeCodec attributeCodec,
                       AttributeValidationDomainService attributeValidationDomainService,
                       AttributeDiffDomainService attributeDiffDomainService) {
        super(agentObjectRepository, attributeCodec, attributeValidationDomainService, attributeDiffDomainService);
    }

    /**
     * 基于 Profile 生成并执行 SQL 的工具
     */
    public ToolEntity createSqlTool(String toolName, String profileName, String description, boolean replace) {
        return createBuiltInTool(toolName, ToolTypeEnum.SQL,
                ToolParams.builder().profileName(profileName).build(), null, description, replace);
    }

    /**
     * 基于 Profile 向量索引检索的工具
     */
    public ToolEntity createRagTool(String toolName, String profileName, String description, boolean replace) {
        return createBuiltInTool(toolName, ToolTypeEnum.RAG,
                ToolParams.builder().profileName(profileName).build(), null, description, replace);
    }

    /**
     * 包装 PL/SQL 函数的工具，函数在调用时才解析
     */
    public ToolEntity createPlSqlTool(String toolName, String function, String description, boolean replace) {
        ToolAttributes attributes = ToolAttributes.builder()
                .function(function)
                .instruction(description)
                .build();
        return createTool(toolName, description, attributes, replace);
    }

    public ToolEntity createWebSearchTool(String toolName, String credentialName, String description, boolean replace) {
        return createBuiltInTool(toolName, ToolTypeEnum.WEBSEARCH,
                ToolParams.builder().credentialName(credentialName).build(), null, description, replace);
    }

    public ToolEntity createEmailNotificationTool(String toolName,
                                                  String credentialName,
                                                  String recipient,
                                                  String sender,
                                                  String smtpHost,
                                                  String description,
                                                  boolean replace) {
        ToolParams params = ToolParams.builder()
                .notificationType(NotificationTypeEnum.EMAIL)
                .credentialName(credentialName)
                .recipient(recipient)
                .sender(sender)
                .smtpHost(smtpHost)
                .build();
        return createBuiltInTool(toolName, ToolTypeEnum.NOTIFICATION, params, null, description, replace);
    }

    public ToolEntity createSlackNotificationTool(String toolName,
                                                  String credentialName,
                                                  String slackChannel,
                                                  String description,
                                                  boolean replace) {
        ToolParams params = ToolParams.builder()
                .notificationType(NotificationTypeEnum.SLACK)
                .credentialName(credentialName)
                .slackChannel(slackChannel)
                .build();
        return createBuiltInTool(toolName, ToolTypeEnum.NOTIFICATION, params, null, description, replace);
    }

    public ToolEntity createHttpTool(String toolName,
                                     String credentialName,
                                     String endpoint,
                                     String description,
                                     boolean replace) {
        ToolParams params = ToolParams.builder()
                .credentialName(credentialName)
                .endpoint(endpoint)
                .build();
        return createBuiltInTool(toolName, ToolTypeEnum.HTTP, params, null, description, replace);
    }

    /**
     * 创建任意内置类型的工具
     */
    public ToolEntity createBuiltInTool(String toolName,
                                        ToolTypeEnum toolType,
                                        ToolParams toolParams,
                                        List<Map<String, Object>> toolInputs,
                                        String description,
                                        boolean replace) {
        ToolAttributes attributes = ToolAttributes.builder()
                .toolType(toolType)
                .toolParams(toolParams)
                .toolInputs(toolInputs)
                .build();
        return createTool(toolName, description, attributes, replace);
    }

    private ToolEntity createTool(String toolName, String description, ToolAttributes attributes, boolean replace) {
        ToolEntity tool = new ToolEntity(toolName, description, attributes);
        create(tool, true, replace);
        return tool;
    }

    @Override
    protected AgentObjectTypeEnum objectType() {
        return AgentObjectTypeEnum.TOOL;
    }

    @Override
    protected AttributeSchema schema() {
        return ToolAttributes.SCHEMA;
    }

    @Override
    protected Class<ToolAttributes> attributesType() {
        return ToolAttributes.class;
    }

    @Override
    protected ToolEntity newEntity(String name, String description, ToolAttributes attributes) {
        return new ToolEntity(name, description, attributes);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name) {
        return new AgentToolNotFoundException(name);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name, AgentDatabaseException cause) {
        return new AgentToolNotFoundException(name, cause);
    }
}
