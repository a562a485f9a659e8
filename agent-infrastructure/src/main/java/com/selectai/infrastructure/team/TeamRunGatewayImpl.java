package com.selectai.infrastructure.team;

import com.selectai.domain.team.adapter.gateway.ITeamRunGateway;
import com.selectai.infrastructure.dao.AgentTeamDao;
import com.selectai.infrastructure.dao.po.TeamRunPO;
import com.selectai.infrastructure.util.JsonCodec;
import com.selectai.infrastructure.util.OracleErrorTranslator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * RUN_TEAM 网关实现，参数以 JSON 传入，返回 CLOB 文本。
 */
@Slf4j
@Component
public class TeamRunGatewayImpl implements ITeamRunGateway {

    private final AgentTeamDao agentTeamDao;
    private final JsonCodec jsonCodec;
    private final OracleErrorTranslator oracleErrorTranslator;
    private final long slowCallThresholdMs;

    public TeamRunGatewayImpl(AgentTeamDao agentTeamDao,
                              JsonCodec jsonCodec,
                              OracleErrorTranslator oracleErrorTranslator,
                              @Value("${select-ai.agent.slow-call-threshold-ms:500}") long slowCallThresholdMs) {
        this.agentTeamDao = agentTeamDao;
        this.jsonCodec = jsonCodec;
        this.oracleErrorTranslator = oracleErrorTranslator;
        this.slowCallThresholdMs = Math.max(slowCallThresholdMs, 1L);
    }

    @Override
    public String runTeam(String teamName, String userPrompt, Map<String, Object> params) {
        TeamRunPO po = TeamRunPO.builder()
                .teamName(teamName)
                .userPrompt(userPrompt)
                .params(jsonCodec.writeValue(params))
                .build();
        long startNs = System.nanoTime();
        try {
            agentTeamDao.runTeam(po);
        } catch (RuntimeException ex) {
            throw oracleErrorTranslator.translate(ex);
        } finally {
            logCallCost(teamName, startNs);
        }
        log.debug("RUN_TEAM returned. team={}, length={}", teamName,
                po.getResponse() == null ? 0 : po.getResponse().length());
        return po.getResponse();
    }

    private void logCallCost(String teamName, long startNs) {
        long costMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        if (costMs >= slowCallThresholdMs) {
            log.warn("Team call 'run' slow: {} ms, target={}", costMs, teamName);
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("Team call 'run' cost {} ms, target={}", costMs, teamName);
        }
    }
}
