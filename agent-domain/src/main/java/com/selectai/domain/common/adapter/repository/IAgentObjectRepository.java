package com.selectai.domain.common.adapter.repository;

import com.selectai.domain.common.model.valobj.AgentObjectSnapshot;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.enums.AgentObjectTypeEnum;

import java.util.List;
import java.util.Map;

/**
 * 数据库侧对象仓储接口。
 * <p>
 * 每个方法对应一次远程调用；数据库返回的错误以
 * {@link com.selectai.types.exception.AgentDatabaseException} 抛出，错误码与消息保持原样。
 * </p>
 */
public interface IAgentObjectRepository {

    /**
     * 创建对象；replace 为 true 时先删除同名对象，二者在同一次调用中完成
     */
    void create(AgentObjectTypeEnum type,
                String name,
                String description,
                Map<String, Object> attributes,
                AgentObjectStatusEnum status,
                boolean replace);

    /**
     * 按名称查询（含属性），不存在时返回 null
     */
    AgentObjectSnapshot findByName(AgentObjectTypeEnum type, String name);

    /**
     * 按名称正则查询，结果不含属性
     */
    List<AgentObjectSnapshot> findByPattern(AgentObjectTypeEnum type, String pattern);

    /**
     * 查询对象属性，不存在时返回空 Map
     */
    Map<String, String> findAttributes(AgentObjectTypeEnum type, String name);

    /**
     * 查询对象状态，不存在时返回 null
     */
    AgentObjectStatusEnum findStatus(AgentObjectTypeEnum type, String name);

    void enable(AgentObjectTypeEnum type, String name);

    void disable(AgentObjectTypeEnum type, String name);

    /**
     * 修改单个属性
     */
    void setAttribute(AgentObjectTypeEnum type, String name, String attributeName, Object attributeValue);

    /**
     * 整体替换属性
     */
    void setAttributes(AgentObjectTypeEnum type, String name, Map<String, Object> attributes);

    void delete(AgentObjectTypeEnum type, String name, boolean force);

    /**
     * 统计对象视图中的对象数量，用于启动检查
     */
    int countObjects(AgentObjectTypeEnum type);
}
