package com.selectai.domain.team.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.domain.common.service.AgentObjectLifecycleService;
import com.selectai.domain.common.service.AttributeCodec;
import com.selectai.domain.common.service.AttributeDiffDomainService;
import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.domain.team.adapter.gateway.ITeamRunGateway;
import com.selectai.domain.team.model.entity.TeamEntity;
import com.selectai.domain.team.model.valobj.TeamAttributes;
import com.selectai.domain.team.model.valobj.TeamRunResult;
import com.selectai.types.common.Constants;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.TeamRunStatusEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AgentObjectNotFoundException;
import com.selectai.types.exception.AgentTeamNotFoundException;
import com.selectai.types.exception.AttributeValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Team 生命周期服务与运行入口。
 * <p>
 * 与其他对象不同，数据库拒绝对 Team 重复 enable / disable；删除后的任何操作都会失败。
 * </p>
 */
@Slf4j
@Service
public class TeamService extends AgentObjectLifecycleService<TeamEntity, TeamAttributes> {

    /**
     * 等待人工输入时返回 JSON 中 status 字段的取值
     */
    private static final String WAITING_FOR_HUMAN = "WAITING_FOR_HUMAN";

    private static final String STATUS_FIELD = "status";

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ITeamRunGateway teamRunGateway;
    private final ObjectMapper objectMapper;

    public TeamService(IAgentObjectRepository agentObjectRepository,
                       AttributeCodec attributeCodec,
                       AttributeValidationDomainService attributeValidationDomainService,
                       AttributeDiffDomainService attributeDiffDomainService,
                       ITeamRunGateway teamRunGateway,
                       ObjectMapper objectMapper) {
        super(agentObjectRepository, attributeCodec, attributeValidationDomainService, attributeDiffDomainService);
        this.teamRunGateway = teamRunGateway;
        this.objectMapper = objectMapper;
    }

    /**
     * 运行一轮对话。
     * <p>
     * 同一会话的多轮调用使用相同的 conversation_id；返回 HUMAN_INPUT_REQUIRED 时，
     * 以用户的回答作为下一轮 prompt 继续调用。
     * </p>
     *
     * @param team   已创建的 Team
     * @param prompt 用户输入
     * @param params 运行参数，必须包含 conversation_id
     */
    public TeamRunResult run(TeamEntity team, String prompt, Map<String, Object> params) {
        if (team == null || StringUtils.isBlank(team.getName())) {
            throw new AttributeValidationException(AgentObjectTypeEnum.TEAM, null, "Team name cannot be empty");
        }
        Map<String, Object> runParams = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        Object conversationId = runParams.get(Constants.CONVERSATION_ID);
        if (conversationId == null || StringUtils.isBlank(conversationId.toString())) {
            throw new AttributeValidationException(AgentObjectTypeEnum.TEAM, Constants.CONVERSATION_ID,
                    "Team: run parameter '" + Constants.CONVERSATION_ID + "' is required");
        }

        long start = System.currentTimeMillis();
        String text = teamRunGateway.runTeam(team.getName(), prompt, runParams);
        TeamRunResult result = toResult(conversationId.toString(), text);
        log.info("Team run finished. name={}, conversationId={}, status={}, costMs={}",
                team.getName(), conversationId, result.getStatus(), System.currentTimeMillis() - start);
        return result;
    }

    private TeamRunResult toResult(String conversationId, String text) {
        Map<String, Object> payload = parseObject(text);
        TeamRunStatusEnum status = payload != null && WAITING_FOR_HUMAN.equals(payload.get(STATUS_FIELD))
                ? TeamRunStatusEnum.HUMAN_INPUT_REQUIRED
                : TeamRunStatusEnum.FINAL_ANSWER;
        return TeamRunResult.builder()
                .conversationId(conversationId)
                .status(status)
                .text(text)
                .payload(payload)
                .build();
    }

    private Map<String, Object> parseObject(String text) {
        if (text == null || !text.trim().startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readValue(text, MAP_REF);
        } catch (JsonProcessingException ex) {
            // 以 { 开头的普通文本
            log.debug("Team run output is not a json object: {}", ex.getOriginalMessage());
            return null;
        }
    }

    @Override
    protected AgentObjectTypeEnum objectType() {
        return AgentObjectTypeEnum.TEAM;
    }

    @Override
    protected AttributeSchema schema() {
        return TeamAttributes.SCHEMA;
    }

    @Override
    protected Class<TeamAttributes> attributesType() {
        return TeamAttributes.class;
    }

    @Override
    protected TeamEntity newEntity(String name, String description, TeamAttributes attributes) {
        return new TeamEntity(name, description, attributes);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name) {
        return new AgentTeamNotFoundException(name);
    }

    @Override
    protected AgentObjectNotFoundException notFound(String name, AgentDatabaseException cause) {
        return new AgentTeamNotFoundException(name, cause);
    }
}
