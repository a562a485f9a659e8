package com.selectai.test;

import com.selectai.domain.task.model.entity.TaskEntity;
import com.selectai.domain.task.model.valobj.TaskAttributes;
import com.selectai.test.support.AgentObjectServiceFixture;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.exception.AgentTaskNotFoundException;
import com.selectai.types.exception.AttributeValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TaskServiceTest {

    private final AgentObjectServiceFixture fixture = new AgentObjectServiceFixture();

    private TaskEntity newTask(String name) {
        return new TaskEntity(name, "task description", TaskAttributes.builder()
                .instruction("Help the user with their request about movies. User question: {query}")
                .tools(List.of("MOVIE_SQL_TOOL"))
                .enableHumanTool(false)
                .build());
    }

    @Test
    public void shouldKeepInstructionVerbatim() {
        TaskEntity task = newTask("PYSAI_TASK");
        fixture.taskService.create(task);

        TaskEntity fetched = fixture.taskService.fetch("PYSAI_TASK");

        Assertions.assertEquals(task.getAttributes(), fetched.getAttributes());
        Assertions.assertEquals("Help the user with their request about movies. User question: {query}",
                fetched.getAttributes().getInstruction());
    }

    @Test
    public void shouldRejectEmptyInstruction() {
        TaskEntity task = new TaskEntity("EMPTY", null, TaskAttributes.builder().instruction("").build());

        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.taskService.create(task));
        Assertions.assertNull(fixture.taskService.getStatus("EMPTY"));
    }

    @Test
    public void shouldRejectNullAttributes() {
        TaskEntity task = new TaskEntity("NO_ATTRS", null, null);

        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.taskService.create(task));
    }

    @Test
    public void shouldRejectBlankName() {
        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.taskService.create(newTask(" ")));
    }

    @Test
    public void shouldToggleStatus() {
        TaskEntity task = newTask("TOGGLE");
        fixture.taskService.create(task);
        Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, fixture.taskService.getStatus("TOGGLE"));

        fixture.taskService.disable(task);
        Assertions.assertEquals(AgentObjectStatusEnum.DISABLED, fixture.taskService.getStatus("TOGGLE"));

        fixture.taskService.enable(task);
        Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, fixture.taskService.getStatus("TOGGLE"));
    }

    @Test
    public void shouldDeleteEnabledTaskWithoutForce() {
        TaskEntity task = newTask("ENABLED_TASK");
        fixture.taskService.create(task);

        fixture.taskService.delete(task);

        Assertions.assertNull(fixture.taskService.getStatus("ENABLED_TASK"));
    }

    @Test
    public void shouldUpdateToolsList() {
        TaskEntity task = newTask("TOOLS");
        fixture.taskService.create(task);

        fixture.taskService.setAttribute(task, "tools", List.of("A", "B"));

        Assertions.assertEquals(List.of("A", "B"), fixture.taskService.fetch("TOOLS").getAttributes().getTools());
        Assertions.assertThrows(AttributeValidationException.class,
                () -> fixture.taskService.setAttribute(task, "tools", List.of("")));
    }

    @Test
    public void shouldFailAfterDelete() {
        TaskEntity task = newTask("GONE");
        fixture.taskService.create(task);
        fixture.taskService.delete(task, true);

        AgentTaskNotFoundException ex = Assertions.assertThrows(AgentTaskNotFoundException.class,
                () -> fixture.taskService.disable(task));
        Assertions.assertTrue(ex.getMessage().contains("ORA-20051"));
        Assertions.assertThrows(AgentTaskNotFoundException.class, () -> fixture.taskService.enable(task));
        Assertions.assertThrows(AgentTaskNotFoundException.class,
                () -> fixture.taskService.setAttribute(task, "instruction", "Summarize the results"));
        Assertions.assertThrows(AgentTaskNotFoundException.class,
                () -> fixture.taskService.setAttributes(task, task.getAttributes()));
        Assertions.assertThrows(AgentTaskNotFoundException.class, () -> fixture.taskService.delete(task));
        Assertions.assertThrows(AgentTaskNotFoundException.class, () -> fixture.taskService.fetch("GONE"));
    }
}
