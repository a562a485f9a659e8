package com.selectai.infrastructure.dao;

import com.selectai.infrastructure.dao.po.AgentObjectAttributePO;
import com.selectai.infrastructure.dao.po.AgentObjectCallPO;
import com.selectai.infrastructure.dao.po.AgentObjectPO;
import com.selectai.infrastructure.dao.po.AgentObjectQueryPO;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * Profile / Tool / Task / Agent / Team 通用 DAO。
 * 写操作为 PL/SQL 过程调用，读操作查询 USER_* 视图。
 *
 * @author selectai
 * @since 2025-06-10
 */
@Mapper
public interface AgentObjectDao {

    /**
     * CREATE_*；replace 时在同一 PL/SQL 块中先删除同名对象
     */
    void create(AgentObjectCallPO po);

    /**
     * ENABLE_* / DISABLE_* 等仅需名称的过程
     */
    void callByName(AgentObjectCallPO po);

    /**
     * DROP_*
     */
    void drop(AgentObjectCallPO po);

    void setAttribute(AgentObjectCallPO po);

    void setAttributes(AgentObjectCallPO po);

    /**
     * 按名称查询
     */
    AgentObjectPO selectByName(AgentObjectQueryPO query);

    /**
     * 按名称正则查询，按名称排序
     */
    List<AgentObjectPO> selectByPattern(AgentObjectQueryPO query);

    /**
     * 查询对象属性
     */
    List<AgentObjectAttributePO> selectAttributes(AgentObjectQueryPO query);

    /**
     * 查询状态列原值
     */
    String selectStatus(AgentObjectQueryPO query);

    /**
     * 视图可读性检查
     */
    Integer countObjects(AgentObjectQueryPO query);
}
