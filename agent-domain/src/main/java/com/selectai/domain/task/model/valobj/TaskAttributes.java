package com.selectai.domain.task.model.valobj;

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

import java.util.List;

import static com.selectai.types.enums.AttributeTypeEnum.BOOLEAN;
import static com.selectai.types.enums.AttributeTypeEnum.STRING;
import static com.selectai.types.enums.AttributeTypeEnum.STRING_LIST;

/**
 * 任务属性
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskAttributes implements AgentObjectAttributes {

    public static final AttributeSchema SCHEMA = AttributeSchema.builder(AgentObjectTypeEnum.TASK)
            .required("instruction", STRING)
            .optional("tools", STRING_LIST)
            .optional("input", STRING)
            .optional("enable_human_tool", BOOLEAN)
            .build();

    /**
     * 任务指令，原样保存
     */
    private String instruction;

    /**
     * 可用工具名
     */
    private List<String> tools;

    /**
     * 上游任务名，其输出作为本任务输入
     */
    private String input;

    private Boolean enableHumanTool;
}
