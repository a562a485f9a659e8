package com.selectai.infrastructure.repository;

import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.valobj.AgentObjectSnapshot;
import com.selectai.infrastructure.dao.AgentObjectDao;
import com.selectai.infrastructure.dao.po.AgentObjectAttributePO;
import com.selectai.infrastructure.dao.po.AgentObjectCallPO;
import com.selectai.infrastructure.dao.po.AgentObjectPO;
import com.selectai.infrastructure.dao.po.AgentObjectQueryPO;
import com.selectai.infrastructure.util.JsonCodec;
import com.selectai.infrastructure.util.OracleErrorTranslator;
import com.selectai.types.common.Constants;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 数据库侧对象仓储实现类。
 * <p>
 * 负责：
 * <ul>
 *   <li>按对象类型拼装过程名、视图名，发起一次 PL/SQL 调用或视图查询</li>
 *   <li>属性 Map 与 JSON 之间的转换</li>
 *   <li>SQLException 转换为 AgentDatabaseException，错误码与消息不变</li>
 *   <li>慢调用日志</li>
 * </ul>
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
@Slf4j
@Repository
public class AgentObjectRepositoryImpl implements IAgentObjectRepository {

    private final AgentObjectDao agentObjectDao;
    private final JsonCodec jsonCodec;
    private final OracleErrorTranslator oracleErrorTranslator;
    private final long slowCallThresholdMs;

    public AgentObjectRepositoryImpl(AgentObjectDao agentObjectDao,
                                     JsonCodec jsonCodec,
                                     OracleErrorTranslator oracleErrorTranslator,
                                     @Value("${select-ai.agent.slow-call-threshold-ms:500}") long slowCallThresholdMs) {
        this.agentObjectDao = agentObjectDao;
        this.jsonCodec = jsonCodec;
        this.oracleErrorTranslator = oracleErrorTranslator;
        this.slowCallThresholdMs = Math.max(slowCallThresholdMs, 1L);
    }

    @Override
    public void create(AgentObjectTypeEnum type,
                       String name,
                       String description,
                       Map<String, Object> attributes,
                       AgentObjectStatusEnum status,
                       boolean replace) {
        AgentObjectCallPO po = callPO(type, type.createProcedure(), name);
        po.setDescription(description);
        po.setAttributes(jsonCodec.writeValue(attributes == null ? new LinkedHashMap<>() : attributes));
        po.setStatus(status == null ? null : status.getCode());
        po.setReplace(replace);
        if (replace) {
            po.setDropProcedure(type.dropProcedure());
            po.setObjectView(type.getObjectView());
            po.setNameColumn(type.getNameColumn());
        }
        execute(type, "create", name, () -> agentObjectDao.create(po));
    }

    @Override
    public AgentObjectSnapshot findByName(AgentObjectTypeEnum type, String name) {
        AgentObjectQueryPO query = queryPO(type);
        query.setName(name);
        AgentObjectPO po = call(type, "findByName", name, () -> agentObjectDao.selectByName(query));
        if (po == null) {
            return null;
        }
        AgentObjectSnapshot snapshot = toSnapshot(po);
        snapshot.setAttributes(findAttributes(type, po.getName()));
        return snapshot;
    }

    @Override
    public List<AgentObjectSnapshot> findByPattern(AgentObjectTypeEnum type, String pattern) {
        AgentObjectQueryPO query = queryPO(type);
        query.setPattern(pattern);
        query.setMatchParameter(Constants.REGEXP_MATCH_IGNORE_CASE);
        List<AgentObjectPO> rows = call(type, "findByPattern", pattern, () -> agentObjectDao.selectByPattern(query));
        return rows.stream()
                .map(this::toSnapshot)
                .collect(Collectors.toList());
    }

    @Override
    public Map<String, String> findAttributes(AgentObjectTypeEnum type, String name) {
        AgentObjectQueryPO query = queryPO(type);
        query.setName(name);
        List<AgentObjectAttributePO> rows = call(type, "findAttributes", name, () -> agentObjectDao.selectAttributes(query));
        Map<String, String> attributes = new LinkedHashMap<>();
        for (AgentObjectAttributePO row : rows) {
            if (row.getAttributeName() == null) {
                continue;
            }
            attributes.put(row.getAttributeName().toLowerCase(Locale.ROOT), row.getAttributeValue());
        }
        return attributes;
    }

    @Override
    public AgentObjectStatusEnum findStatus(AgentObjectTypeEnum type, String name) {
        AgentObjectQueryPO query = queryPO(type);
        query.setName(name);
        String status = call(type, "findStatus", name, () -> agentObjectDao.selectStatus(query));
        return AgentObjectStatusEnum.fromCode(status);
    }

    @Override
    public void enable(AgentObjectTypeEnum type, String name) {
        AgentObjectCallPO po = callPO(type, type.enableProcedure(), name);
        execute(type, "enable", name, () -> agentObjectDao.callByName(po));
    }

    @Override
    public void disable(AgentObjectTypeEnum type, String name) {
        AgentObjectCallPO po = callPO(type, type.disableProcedure(), name);
        execute(type, "disable", name, () -> agentObjectDao.callByName(po));
    }

    @Override
    public void setAttribute(AgentObjectTypeEnum type, String name, String attributeName, Object attributeValue) {
        AgentObjectCallPO po = callPO(type, type.setAttributeProcedure(), name);
        po.setObjectType(type.requiresObjectTypeParameter() ? type.getCode() : null);
        po.setAttributeName(attributeName);
        po.setAttributeValue(jsonCodec.writeAttributeValue(attributeValue));
        execute(type, "setAttribute", name, () -> agentObjectDao.setAttribute(po));
    }

    @Override
    public void setAttributes(AgentObjectTypeEnum type, String name, Map<String, Object> attributes) {
        AgentObjectCallPO po = callPO(type, type.setAttributesProcedure(), name);
        po.setObjectType(type.requiresObjectTypeParameter() ? type.getCode() : null);
        po.setAttributes(jsonCodec.writeValue(attributes == null ? new LinkedHashMap<>() : attributes));
        execute(type, "setAttributes", name, () -> agentObjectDao.setAttributes(po));
    }

    @Override
    public void delete(AgentObjectTypeEnum type, String name, boolean force) {
        AgentObjectCallPO po = callPO(type, type.dropProcedure(), name);
        po.setForce(force);
        execute(type, "delete", name, () -> agentObjectDao.drop(po));
    }

    @Override
    public int countObjects(AgentObjectTypeEnum type) {
        Integer count = call(type, "countObjects", type.getObjectView(), () -> agentObjectDao.countObjects(queryPO(type)));
        return count == null ? 0 : count;
    }

    private AgentObjectCallPO callPO(AgentObjectTypeEnum type, String procedure, String name) {
        return AgentObjectCallPO.builder()
                .procedure(procedure)
                .nameParameter(type.getNameParameter())
                .name(name)
                .build();
    }

    private AgentObjectQueryPO queryPO(AgentObjectTypeEnum type) {
        return AgentObjectQueryPO.builder()
                .objectView(type.getObjectView())
                .attributeView(type.getAttributeView())
                .nameColumn(type.getNameColumn())
                .build();
    }

    private AgentObjectSnapshot toSnapshot(AgentObjectPO po) {
        return AgentObjectSnapshot.builder()
                .name(po.getName())
                .description(po.getDescription())
                .status(po.getStatus())
                .build();
    }

    private void execute(AgentObjectTypeEnum type, String operation, String target, Runnable action) {
        call(type, operation, target, () -> {
            action.run();
            return null;
        });
    }

    private <T> T call(AgentObjectTypeEnum type, String operation, String target, Supplier<T> action) {
        long startNs = System.nanoTime();
        try {
            return action.get();
        } catch (RuntimeException ex) {
            throw oracleErrorTranslator.translate(ex);
        } finally {
            logCallCost(type, operation, startNs, target);
        }
    }

    private void logCallCost(AgentObjectTypeEnum type, String operation, long startNs, String target) {
        long costMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        if (costMs >= slowCallThresholdMs) {
            log.warn("{} call '{}' slow: {} ms, target={}", type.getDisplayName(), operation, costMs, target);
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("{} call '{}' cost {} ms, target={}", type.getDisplayName(), operation, costMs, target);
        }
    }
}
