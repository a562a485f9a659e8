package com.selectai.domain.common.service;

import com.selectai.domain.common.adapter.repository.IAgentObjectRepository;
import com.selectai.domain.common.model.entity.AgentObjectEntity;
import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.domain.common.model.valobj.AgentObjectSnapshot;
import com.selectai.domain.common.model.valobj.AttributeChangeSet;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.common.Constants;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AgentObjectNotFoundException;
import com.selectai.types.exception.AppException;
import com.selectai.types.exception.AttributeValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 数据库侧对象的统一生命周期服务。
 * <p>
 * Profile、Tool、Task、Agent、Team 共用同一套契约：
 * <ul>
 *   <li>create / fetch / list / enable / disable / setAttribute / setAttributes / delete</li>
 *   <li>每个操作一次远程调用，失败原样抛出，不重试、不吞异常</li>
 *   <li>属性在发起调用前按属性表校验，校验失败不修改任何状态</li>
 *   <li>对已删除对象的调用失败时转换为该类型的 NotFound 异常，保留原始 ORA 错误码与消息</li>
 * </ul>
 * 子类只提供对象类型、属性表、属性类型与 NotFound 异常。
 * </p>
 *
 * @param <E> 实体类型
 * @param <A> 属性记录类型
 */
@Slf4j
public abstract class AgentObjectLifecycleService<E extends AgentObjectEntity<A>, A extends AgentObjectAttributes> {

    protected final IAgentObjectRepository agentObjectRepository;
    protected final AttributeCodec attributeCodec;
    protected final AttributeValidationDomainService attributeValidationDomainService;
    protected final AttributeDiffDomainService attributeDiffDomainService;

    protected AgentObjectLifecycleService(IAgentObjectRepository agentObjectRepository,
                                          AttributeCodec attributeCodec,
                                          AttributeValidationDomainService attributeValidationDomainService,
                                          AttributeDiffDomainService attributeDiffDomainService) {
        this.agentObjectRepository = agentObjectRepository;
        this.attributeCodec = attributeCodec;
        this.attributeValidationDomainService = attributeValidationDomainService;
        this.attributeDiffDomainService = attributeDiffDomainService;
    }

    protected abstract AgentObjectTypeEnum objectType();

    protected abstract AttributeSchema schema();

    protected abstract Class<A> attributesType();

    protected abstract E newEntity(String name, String description, A attributes);

    protected abstract AgentObjectNotFoundException notFound(String name);

    protected abstract AgentObjectNotFoundException notFound(String name, AgentDatabaseException cause);

    /**
     * 创建并启用，同名对象存在时失败。
     */
    public void create(E entity) {
        create(entity, true, false);
    }

    /**
     * 创建对象。
     *
     * @param entity 待创建对象
     * @param enabled 创建后的状态
     * @param replace true 时整体覆盖同名对象（属性不合并）。先删后建，建失败时旧对象已不存在
     */
    public void create(E entity, boolean enabled, boolean replace) {
        String name = requireName(entity);
        Map<String, Object> attributes = encodeAndValidate(entity.getAttributes());
        AgentObjectStatusEnum status = enabled ? AgentObjectStatusEnum.ENABLED : AgentObjectStatusEnum.DISABLED;
        agentObjectRepository.create(objectType(), name, entity.getDescription(), attributes, status, replace);
        entity.setStatus(status);
        log.info("{} created. name={}, status={}, replace={}", objectType().getDisplayName(), name, status, replace);
    }

    /**
     * 按名称获取对象。
     *
     * @throws AgentObjectNotFoundException 对象不存在
     */
    public E fetch(String name) {
        AgentObjectSnapshot snapshot = agentObjectRepository.findByName(objectType(), name);
        if (snapshot == null) {
            throw notFound(name);
        }
        return toEntity(snapshot, snapshot.getAttributes());
    }

    /**
     * 列出该类型的全部对象。
     */
    public Stream<E> list() {
        return list(null);
    }

    /**
     * 按名称正则列出对象，正则由数据库解释（忽略大小写）。
     * <p>
     * 返回的 Stream 只能消费一次，每个元素的属性在迭代到时才加载；需要重新遍历时再次调用 list。
     * 非法正则由数据库报错并原样抛出。
     * </p>
     */
    public Stream<E> list(String pattern) {
        String effectivePattern = StringUtils.isEmpty(pattern) ? Constants.MATCH_ALL_PATTERN : pattern;
        List<AgentObjectSnapshot> snapshots = agentObjectRepository.findByPattern(objectType(), effectivePattern);
        log.debug("{} list matched {} objects. pattern={}", objectType().getDisplayName(), snapshots.size(), effectivePattern);
        return snapshots.stream()
                .map(snapshot -> toEntity(snapshot,
                        agentObjectRepository.findAttributes(objectType(), snapshot.getName())));
    }

    /**
     * 查询数据库中的当前状态，对象不存在时返回 null。
     */
    public AgentObjectStatusEnum getStatus(String name) {
        return agentObjectRepository.findStatus(objectType(), name);
    }

    /**
     * @throws AgentObjectNotFoundException 对象不存在
     */
    public void enable(E entity) {
        String name = requireName(entity);
        callExisting(name, () -> agentObjectRepository.enable(objectType(), name));
        entity.setStatus(AgentObjectStatusEnum.ENABLED);
        log.info("{} enabled. name={}", objectType().getDisplayName(), name);
    }

    public void disable(E entity) {
        String name = requireName(entity);
        callExisting(name, () -> agentObjectRepository.disable(objectType(), name));
        entity.setStatus(AgentObjectStatusEnum.DISABLED);
        log.info("{} disabled. name={}", objectType().getDisplayName(), name);
    }

    /**
     * 修改单个属性，其余属性保持不变。
     * <p>
     * 属性名未知、值为 null 或空串时拒绝，不发起调用，本地属性也不变。
     * </p>
     */
    public void setAttribute(E entity, String attributeName, Object attributeValue) {
        String name = requireName(entity);
        String key = attributeCodec.normalizeName(attributeName);
        Object value = attributeCodec.normalizeValue(attributeValue);
        attributeValidationDomainService.validateAttribute(schema(), key, value);

        Map<String, Object> updated = new LinkedHashMap<>(attributeCodec.encode(entity.getAttributes()));
        updated.put(key, value);
        A candidate = attributeCodec.fromMap(updated, attributesType());

        callExisting(name, () -> agentObjectRepository.setAttribute(objectType(), name, key, value));
        entity.setAttributes(candidate);
        log.info("{} attribute updated. name={}, attribute={}", objectType().getDisplayName(), name, key);
    }

    /**
     * 整体替换属性记录，校验规则与 create 相同。
     */
    public void setAttributes(E entity, A attributes) {
        String name = requireName(entity);
        Map<String, Object> encoded = encodeAndValidate(attributes);
        AttributeChangeSet changes = attributeDiffDomainService.diff(attributeCodec.encode(entity.getAttributes()), encoded);

        callExisting(name, () -> agentObjectRepository.setAttributes(objectType(), name, encoded));
        entity.setAttributes(attributes);
        log.info("{} attributes replaced. name={}, {}", objectType().getDisplayName(), name, changes);
    }

    /**
     * 删除对象，非强制。
     */
    public void delete(E entity) {
        delete(entity, false);
    }

    /**
     * 删除对象。force 为 true 时跳过数据库侧的状态检查。
     * <p>
     * 对已删除对象的行为取决于对象类型：数据库接受时视为成功（如强制删除 Agent），
     * 报错时抛出该类型的 NotFound 异常。
     * </p>
     */
    public void delete(E entity, boolean force) {
        String name = requireName(entity);
        callExisting(name, () -> agentObjectRepository.delete(objectType(), name, force));
        entity.setStatus(null);
        log.info("{} deleted. name={}, force={}", objectType().getDisplayName(), name, force);
    }

    protected Map<String, Object> encodeAndValidate(A attributes) {
        if (attributes == null) {
            throw new AttributeValidationException(objectType(), null,
                    objectType().getDisplayName() + ": attributes cannot be null");
        }
        Map<String, Object> encoded = attributeCodec.encode(attributes);
        attributeValidationDomainService.validateRecord(schema(), encoded);
        attributes.validate();
        return encoded;
    }

    protected E toEntity(AgentObjectSnapshot snapshot, Map<String, String> rawAttributes) {
        A attributes = attributeCodec.decode(schema(), rawAttributes, attributesType());
        E entity = newEntity(snapshot.getName(), snapshot.getDescription(), attributes);
        entity.setStatus(snapshot.getStatus());
        entity.setUnmappedAttributes(attributeCodec.unmapped(schema(), rawAttributes));
        return entity;
    }

    /**
     * 执行针对已有对象的远程调用。数据库报错且对象已不存在时，转换为 NotFound 异常；
     * 对象仍存在时原样抛出（如 Team 重复 enable）。
     */
    private void callExisting(String name, Runnable call) {
        try {
            call.run();
        } catch (AgentDatabaseException ex) {
            throw resolveAbsence(name, ex);
        }
    }

    private AppException resolveAbsence(String name, AgentDatabaseException ex) {
        AgentObjectStatusEnum status;
        try {
            status = agentObjectRepository.findStatus(objectType(), name);
        } catch (RuntimeException lookupEx) {
            ex.addSuppressed(lookupEx);
            return ex;
        }
        if (status != null) {
            return ex;
        }
        log.warn("{} {} does not exist. code={}", objectType().getDisplayName(), name, ex.getCode());
        return notFound(name, ex);
    }

    private String requireName(E entity) {
        if (entity == null || StringUtils.isBlank(entity.getName())) {
            throw new AttributeValidationException(objectType(), null,
                    objectType().getDisplayName() + " name cannot be empty");
        }
        return entity.getName();
    }
}
