package com.selectai.domain.tool.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.selectai.types.enums.NotificationTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工具参数 (tool_params)，各工具类型只使用其中一部分
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolParams {

    /**
     * SQL / RAG 工具使用的 AI Profile
     */
    private String profileName;

    /**
     * 凭据名 (WEBSEARCH / NOTIFICATION / HTTP)
     */
    private String credentialName;

    private NotificationTypeEnum notificationType;

    /**
     * 邮件收件人
     */
    private String recipient;

    /**
     * 邮件发件人
     */
    private String sender;

    private String smtpHost;

    private String slackChannel;

    /**
     * HTTP 端点
     */
    private String endpoint;
}
