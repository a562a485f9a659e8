package com.selectai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 客户端配置属性类，配置前缀为 select-ai.agent。
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@ConfigurationProperties(prefix = "select-ai.agent", ignoreInvalidFields = true)
public class SelectAiAgentProperties {

    /** 启动健康检查配置 */
    private HealthCheck healthCheck = new HealthCheck();

    @Data
    public static class HealthCheck {

        /** 是否在启动时检查对象视图，默认开启 */
        private boolean enabled = true;

        /** 视图不可读时是否中止启动，默认中止 */
        private boolean failFast = true;
    }

}
