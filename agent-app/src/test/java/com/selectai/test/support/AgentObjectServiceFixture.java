package com.selectai.test.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.selectai.domain.agent.service.AgentService;
import com.selectai.domain.common.service.AttributeCodec;
import com.selectai.domain.common.service.AttributeDiffDomainService;
import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.domain.profile.service.ProfileService;
import com.selectai.domain.task.service.TaskService;
import com.selectai.domain.team.service.TeamService;
import com.selectai.domain.tool.service.ToolService;

/**
 * 基于内存仓储装配五类对象服务。
 */
public class AgentObjectServiceFixture {

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final InMemoryAgentObjectRepository repository = new InMemoryAgentObjectRepository();
    public final InMemoryTeamRunGateway teamRunGateway = new InMemoryTeamRunGateway();
    public final AttributeCodec codec = new AttributeCodec(objectMapper);
    public final AttributeValidationDomainService validation = new AttributeValidationDomainService();
    public final AttributeDiffDomainService diff = new AttributeDiffDomainService();

    public final ProfileService profileService = new ProfileService(repository, codec, validation, diff);
    public final ToolService toolService = new ToolService(repository, codec, validation, diff);
    public final TaskService taskService = new TaskService(repository, codec, validation, diff);
    public final AgentService agentService = new AgentService(repository, codec, validation, diff);
    public final TeamService teamService = new TeamService(repository, codec, validation, diff,
            teamRunGateway, objectMapper);
}
