package com.selectai.domain.agent.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.selectai.types.enums.AttributeTypeEnum.BOOLEAN;
import static com.selectai.types.enums.AttributeTypeEnum.STRING;

/**
 * Agent 属性。
 * <p>
 * profile_name 引用的 Profile 在创建时不检查。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentAttributes implements AgentObjectAttributes {

    public static final AttributeSchema SCHEMA = AttributeSchema.builder(AgentObjectTypeEnum.AGENT)
            .required("profile_name", STRING)
            .required("role", STRING)
            .optional("enable_human_tool", BOOLEAN)
            .build();

    private String profileName;

    /**
     * 角色描述
     */
    private String role;

    private Boolean enableHumanTool;
}
