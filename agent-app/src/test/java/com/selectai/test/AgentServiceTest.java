package com.selectai.test;

import com.selectai.domain.agent.model.entity.AgentEntity;
import com.selectai.domain.agent.model.valobj.AgentAttributes;
import com.selectai.test.support.AgentObjectServiceFixture;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.exception.AgentNotFoundException;
import com.selectai.types.exception.AttributeValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AgentServiceTest {

    private final AgentObjectServiceFixture fixture = new AgentObjectServiceFixture();

    private AgentEntity newAgent(String name) {
        return new AgentEntity(name, "agent description", AgentAttributes.builder()
                .profileName("PYSAI_PROFILE")
                .role("You are an AI Movie Analyst.")
                .enableHumanTool(false)
                .build());
    }

    @Test
    public void shouldRequireProfileAndRole() {
        AgentEntity noRole = new AgentEntity("A1", null, AgentAttributes.builder().profileName("P").build());
        AgentEntity noProfile = new AgentEntity("A2", null, AgentAttributes.builder().role("r").build());

        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.agentService.create(noRole));
        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.agentService.create(noProfile));
    }

    @Test
    public void shouldTolerateRepeatedEnable() {
        AgentEntity agent = newAgent("A3");
        fixture.agentService.create(agent);

        fixture.agentService.enable(agent);
        fixture.agentService.enable(agent);

        Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, fixture.agentService.getStatus("A3"));
    }

    @Test
    public void shouldAllowForcedDeleteTwice() {
        AgentEntity agent = newAgent("A4");
        fixture.agentService.create(agent);

        fixture.agentService.delete(agent, true);
        Assertions.assertDoesNotThrow(() -> fixture.agentService.delete(agent, true));
        Assertions.assertThrows(AgentNotFoundException.class, () -> fixture.agentService.fetch("A4"));
    }

    @Test
    public void shouldRaiseNotFoundAfterDelete() {
        AgentEntity agent = newAgent("A5");
        fixture.agentService.create(agent);
        fixture.agentService.delete(agent, true);

        AgentNotFoundException ex = Assertions.assertThrows(AgentNotFoundException.class,
                () -> fixture.agentService.enable(agent));
        Assertions.assertEquals("ORA-20050", ex.getCode());
        Assertions.assertEquals("A5", ex.getObjectName());
        Assertions.assertTrue(ex.getMessage().startsWith("ORA-20050"));
        Assertions.assertThrows(AgentNotFoundException.class, () -> fixture.agentService.disable(agent));
        Assertions.assertThrows(AgentNotFoundException.class,
                () -> fixture.agentService.setAttribute(agent, "role", "r"));
        Assertions.assertThrows(AgentNotFoundException.class,
                () -> fixture.agentService.setAttributes(agent, agent.getAttributes()));
        Assertions.assertThrows(AgentNotFoundException.class, () -> fixture.agentService.delete(agent));
    }

    @Test
    public void shouldChangeRoleOnly() {
        AgentEntity agent = newAgent("A6");
        fixture.agentService.create(agent);

        fixture.agentService.setAttribute(agent, "role", "You are a support agent.");

        AgentAttributes fetched = fixture.agentService.fetch("A6").getAttributes();
        Assertions.assertEquals("You are a support agent.", fetched.getRole());
        Assertions.assertEquals("PYSAI_PROFILE", fetched.getProfileName());
        Assertions.assertFalse(fetched.getEnableHumanTool());
    }
}
