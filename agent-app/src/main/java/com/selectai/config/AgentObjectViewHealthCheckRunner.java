package com.selectai.config;

import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时校验各类对象视图可读（权限、版本是否支持）。
 */
@Slf4j
@Component
public class AgentObjectViewHealthCheckRunner implements ApplicationRunner {

    private final IAgentObjectRepository agentObjectRepository;
    private final SelectAiAgentProperties properties;

    public AgentObjectViewHealthCheckRunner(IAgentObjectRepository agentObjectRepository,
                                            SelectAiAgentProperties properties) {
        this.agentObjectRepository = agentObjectRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getHealthCheck().isEnabled()) {
            log.info("Skip object view health check because select-ai.agent.health-check.enabled=false");
            return;
        }
        for (AgentObjectTypeEnum type : AgentObjectTypeEnum.values()) {
            try {
                int count = agentObjectRepository.countObjects(type);
                log.info("{} view health check passed. view={}, objects={}",
                        type.getDisplayName(), type.getObjectView(), count);
            } catch (RuntimeException ex) {
                if (properties.getHealthCheck().isFailFast()) {
                    throw new IllegalStateException("Object view is not readable: " + type.getObjectView(), ex);
                }
                log.warn("{} view health check failed. view={}, error={}",
                        type.getDisplayName(), type.getObjectView(), ex.getMessage());
            }
        }
    }
}
