package com.selectai.test;

import com.selectai.domain.agent.model.entity.AgentEntity;
import com.selectai.domain.agent.model.valobj.AgentAttributes;
import com.selectai.domain.profile.model.entity.ProfileEntity;
import com.selectai.domain.profile.model.valobj.ProfileAttributes;
import com.selectai.domain.task.model.entity.TaskEntity;
import com.selectai.domain.task.model.valobj.TaskAttributes;
import com.selectai.domain.team.model.entity.TeamEntity;
import com.selectai.domain.team.model.valobj.TeamAttributes;
import com.selectai.domain.team.model.valobj.TeamMember;
import com.selectai.domain.team.model.valobj.TeamRunResult;
import com.selectai.domain.tool.model.entity.ToolEntity;
import com.selectai.domain.tool.model.valobj.ToolParams;
import com.selectai.test.support.AgentObjectServiceFixture;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.enums.TeamProcessEnum;
import com.selectai.types.enums.ToolTypeEnum;
import com.selectai.types.exception.AgentNotFoundException;
import com.selectai.types.exception.AgentTaskNotFoundException;
import com.selectai.types.exception.AgentTeamNotFoundException;
import com.selectai.types.exception.AgentToolNotFoundException;
import com.selectai.types.exception.AttributeValidationException;
import com.selectai.types.exception.ProfileNotFoundException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 端到端场景：Profile → Tool → Task → Agent → Team 全链路，基于内存仓储。
 */
public class AgentObjectEndToEndTest {

    private final AgentObjectServiceFixture fixture = new AgentObjectServiceFixture();

    @Test
    public void shouldBuildRunAndTearDownReturnAgency() {
        ProfileEntity profile = new ProfileEntity("GEN1_PROFILE", null, ProfileAttributes.builder()
                .provider("oci")
                .credentialName("GENAI_CRED")
                .model("meta.llama-3.1-70b-instruct")
                .build());
        fixture.profileService.create(profile, true, true);

        AgentEntity agent = new AgentEntity("CustomerAgent", null, AgentAttributes.builder()
                .profileName("GEN1_PROFILE")
                .role("You are an experienced customer agent who deals with customers' return requests.")
                .build());
        fixture.agentService.create(agent, true, true);

        ToolEntity human = fixture.toolService.createBuiltInTool("Human", ToolTypeEnum.HUMAN, new ToolParams(), null,
                "Human intervention tool", true);
        ToolEntity websearch = fixture.toolService.createWebSearchTool("Websearch", "OPENAI_CRED", null, true);
        ToolEntity email = fixture.toolService.createEmailNotificationTool("Email", "EMAIL_CRED",
                "support@example.com", "noreply@example.com", "smtp.example.com", null, true);

        TaskEntity task = new TaskEntity("Return_And_Price_Match", null, TaskAttributes.builder()
                .instruction("Process a product return request from a customer.")
                .tools(List.of("Human", "Websearch", "Email"))
                .build());
        fixture.taskService.create(task, true, true);
        Assertions.assertEquals(Set.of("Human", "Websearch", "Email"),
                Set.copyOf(fixture.taskService.fetch("Return_And_Price_Match").getAttributes().getTools()));

        TeamEntity team = new TeamEntity("ReturnAgency", null, TeamAttributes.builder()
                .agents(List.of(TeamMember.builder().name("CustomerAgent").task("Return_And_Price_Match").build()))
                .process(TeamProcessEnum.SEQUENTIAL)
                .build());
        fixture.teamService.create(team, true, true);

        Assertions.assertTrue(fixture.profileService.list().anyMatch(p -> "GEN1_PROFILE".equals(p.getName())));
        Assertions.assertTrue(fixture.agentService.list().anyMatch(a -> "CustomerAgent".equals(a.getName())));
        Assertions.assertTrue(fixture.taskService.list().anyMatch(t -> "Return_And_Price_Match".equals(t.getName())));
        Assertions.assertTrue(fixture.teamService.list().anyMatch(t -> "ReturnAgency".equals(t.getName())));
        Assertions.assertTrue(fixture.toolService.list().map(ToolEntity::getName).collect(Collectors.toSet())
                .containsAll(Set.of("Human", "Websearch", "Email")));

        String conversationId = UUID.randomUUID().toString();
        fixture.teamRunGateway
                .reply("{\"status\":\"WAITING_FOR_HUMAN\",\"question\":\"What is the reason for the return?\"}")
                .reply("Your refund of 20 has been processed.");
        TeamRunResult first = fixture.teamService.run(team, "I want to return an office chair",
                Map.of("conversation_id", conversationId));
        TeamRunResult second = fixture.teamService.run(team, "I found a cheaper price",
                Map.of("conversation_id", conversationId));
        Assertions.assertTrue(first.isHumanInputRequired());
        Assertions.assertFalse(second.isHumanInputRequired());

        fixture.teamService.delete(team, true);
        fixture.taskService.delete(task, true);
        fixture.toolService.delete(email, true);
        fixture.toolService.delete(websearch, true);
        fixture.toolService.delete(human, true);
        fixture.agentService.delete(agent, true);
        fixture.profileService.delete(profile, true);

        Assertions.assertThrows(AgentTeamNotFoundException.class, () -> fixture.teamService.fetch("ReturnAgency"));
        Assertions.assertThrows(AgentTaskNotFoundException.class,
                () -> fixture.taskService.fetch("Return_And_Price_Match"));
        for (String tool : List.of("Email", "Websearch", "Human")) {
            Assertions.assertThrows(AgentToolNotFoundException.class, () -> fixture.toolService.fetch(tool));
        }
        Assertions.assertThrows(AgentNotFoundException.class, () -> fixture.agentService.fetch("CustomerAgent"));
        Assertions.assertThrows(ProfileNotFoundException.class, () -> fixture.profileService.fetch("GEN1_PROFILE"));
        Assertions.assertThrows(AgentTaskNotFoundException.class,
                () -> fixture.taskService.setAttributes(task, task.getAttributes()));
    }

    @Test
    public void shouldRejectEmptyInstructionAndKeepExactOne() {
        TaskEntity empty = new TaskEntity("EMPTY_TASK", null, TaskAttributes.builder().instruction("").build());
        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.taskService.create(empty));

        String instruction = "  Line one.\nLine two with {placeholder} and trailing space ";
        fixture.taskService.create(new TaskEntity("EXACT_TASK", null,
                TaskAttributes.builder().instruction(instruction).build()));

        Assertions.assertEquals(instruction, fixture.taskService.fetch("EXACT_TASK").getAttributes().getInstruction());
    }

    @Test
    public void shouldListOnlyPrefixedAgents() {
        for (String name : List.of("PYSAI_AGENT_1", "PYSAI_AGENT_2", "OTHER_AGENT")) {
            fixture.agentService.create(new AgentEntity(name, null,
                    AgentAttributes.builder().profileName("P").role("r").build()));
        }

        Set<String> names = fixture.agentService.list("^PYSAI_")
                .map(AgentEntity::getName)
                .collect(Collectors.toSet());

        Assertions.assertEquals(Set.of("PYSAI_AGENT_1", "PYSAI_AGENT_2"), names);
        fixture.agentService.list("^PYSAI_").forEach(agent -> {
            Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, agent.getStatus());
            Assertions.assertEquals("r", agent.getAttributes().getRole());
        });
    }
}
