package com.selectai.domain.team.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.TeamProcessEnum;
import com.selectai.types.exception.AttributeValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;

import static com.selectai.types.enums.AttributeTypeEnum.OBJECT_LIST;
import static com.selectai.types.enums.AttributeTypeEnum.STRING;

/**
 * Team 属性。agents 的顺序即执行顺序。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TeamAttributes implements AgentObjectAttributes {

    public static final AttributeSchema SCHEMA = AttributeSchema.builder(AgentObjectTypeEnum.TEAM)
            .required("agents", OBJECT_LIST)
            .required("process", STRING, Arrays.stream(TeamProcessEnum.values())
                    .map(TeamProcessEnum::getCode)
                    .toArray(String[]::new))
            .build();

    private List<TeamMember> agents;

    private TeamProcessEnum process;

    @Override
    public void validate() {
        if (agents == null) {
            return;
        }
        for (TeamMember member : agents) {
            if (member == null || StringUtils.isAnyBlank(member.getName(), member.getTask())) {
                throw new AttributeValidationException(AgentObjectTypeEnum.TEAM, "agents",
                        "Team: every entry of 'agents' requires 'name' and 'task'");
            }
        }
    }
}
