package com.selectai.domain.tool.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.NotificationTypeEnum;
import com.selectai.types.enums.ToolTypeEnum;
import com.selectai.types.exception.AttributeValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.selectai.types.enums.AttributeTypeEnum.OBJECT;
import static com.selectai.types.enums.AttributeTypeEnum.OBJECT_LIST;
import static com.selectai.types.enums.AttributeTypeEnum.STRING;

/**
 * 工具属性。
 * <p>
 * tool_type（内置工具）与 function（PL/SQL 函数工具）必须且只能指定一个；
 * 工具参数只检查是否齐全，引用的 Profile、凭据、函数是否存在由数据库在使用时检查。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolAttributes implements AgentObjectAttributes {

    public static final AttributeSchema SCHEMA = AttributeSchema.builder(AgentObjectTypeEnum.TOOL)
            .optional("instruction", STRING)
            .optional("function", STRING)
            .optional("tool_type", STRING, Arrays.stream(ToolTypeEnum.values())
                    .map(ToolTypeEnum::getCode)
                    .toArray(String[]::new))
            .optional("tool_params", OBJECT)
            .optional("tool_inputs", OBJECT_LIST)
            .build();

    /**
     * 工具使用说明，供 Agent 决定何时调用
     */
    private String instruction;

    /**
     * PL/SQL 函数名
     */
    private String function;

    private ToolTypeEnum toolType;

    private ToolParams toolParams;

    /**
     * 函数参数说明，每项含 name / description
     */
    private List<Map<String, Object>> toolInputs;

    @Override
    public void validate() {
        boolean hasType = toolType != null;
        boolean hasFunction = StringUtils.isNotBlank(function);
        if (hasType == hasFunction) {
            throw reject("tool_type", "exactly one of 'tool_type' or 'function' is required");
        }
        if (!hasType) {
            return;
        }
        ToolParams params = toolParams == null ? new ToolParams() : toolParams;
        switch (toolType) {
            case SQL:
            case RAG:
                requireParam("profile_name", params.getProfileName());
                break;
            case WEBSEARCH:
                requireParam("credential_name", params.getCredentialName());
                break;
            case NOTIFICATION:
                requireParam("credential_name", params.getCredentialName());
                if (params.getNotificationType() == null) {
                    throw reject("tool_params", "'notification_type' is required for " + toolType.getCode());
                }
                if (params.getNotificationType() == NotificationTypeEnum.EMAIL) {
                    requireParam("recipient", params.getRecipient());
                    requireParam("sender", params.getSender());
                    requireParam("smtp_host", params.getSmtpHost());
                } else {
                    requireParam("slack_channel", params.getSlackChannel());
                }
                break;
            case HTTP:
                requireParam("endpoint", params.getEndpoint());
                break;
            default:
                break;
        }
    }

    private void requireParam(String name, String value) {
        if (StringUtils.isBlank(value)) {
            throw reject("tool_params", "'" + name + "' is required for " + toolType.getCode() + " tool");
        }
    }

    private static AttributeValidationException reject(String attributeName, String message) {
        return new AttributeValidationException(AgentObjectTypeEnum.TOOL, attributeName, "Tool: " + message);
    }
}
