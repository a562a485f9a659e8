package com.selectai.test.domain;

import com.selectai.domain.common.service.AttributeValidationDomainService;
import com.selectai.domain.profile.model.valobj.ProfileAttributes;
import com.selectai.domain.task.model.valobj.TaskAttributes;
import com.selectai.domain.team.model.valobj.TeamAttributes;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.ResponseCode;
import com.selectai.types.exception.AttributeValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AttributeValidationDomainServiceTest {

    private final AttributeValidationDomainService service = new AttributeValidationDomainService();

    @Test
    public void shouldAcceptValidRecord() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("instruction", "Summarize the report");
        attributes.put("tools", List.of("SQL_TOOL"));
        attributes.put("enable_human_tool", false);

        Assertions.assertDoesNotThrow(() -> service.validateRecord(TaskAttributes.SCHEMA, attributes));
    }

    @Test
    public void shouldRejectMissingRequiredAttribute() {
        AttributeValidationException ex = Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateRecord(TaskAttributes.SCHEMA, Map.of("tools", List.of("A"))));

        Assertions.assertEquals("instruction", ex.getAttributeName());
        Assertions.assertEquals(AgentObjectTypeEnum.TASK, ex.getObjectType());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectEmptyInstruction() {
        Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateRecord(TaskAttributes.SCHEMA, Map.of("instruction", "")));
    }

    @Test
    public void shouldRejectUnknownAttribute() {
        AttributeValidationException ex = Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateAttribute(ProfileAttributes.SCHEMA, "no_such_key", "x"));

        Assertions.assertEquals("no_such_key", ex.getAttributeName());
        Assertions.assertTrue(ex.getMessage().startsWith("Profile: "));
    }

    @Test
    public void shouldRejectNullValue() {
        Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateAttribute(ProfileAttributes.SCHEMA, "model", null));
    }

    @Test
    public void shouldRejectWrongType() {
        Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateAttribute(ProfileAttributes.SCHEMA, "max_tokens", "1024"));
        Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateAttribute(ProfileAttributes.SCHEMA, "comments", "true"));
    }

    @Test
    public void shouldRejectDisallowedValueIgnoringCase() {
        Assertions.assertDoesNotThrow(
                () -> service.validateAttribute(TeamAttributes.SCHEMA, "process", "SEQUENTIAL"));
        Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateAttribute(TeamAttributes.SCHEMA, "process", "parallel"));
    }

    @Test
    public void shouldRejectEmptyRequiredList() {
        Map<String, Object> attributes = Map.of("agents", List.of(), "process", "sequential");

        Assertions.assertThrows(AttributeValidationException.class,
                () -> service.validateRecord(TeamAttributes.SCHEMA, attributes));
    }
}
