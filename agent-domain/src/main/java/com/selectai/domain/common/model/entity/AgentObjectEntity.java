package com.selectai.domain.common.model.entity;

import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.enums.AgentObjectTypeEnum;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据库侧对象的本地镜像。
 * <p>
 * name 在同类型内唯一，创建后不可变；status 由数据库维护，
 * 本地值只反映最近一次 create/enable/disable 的结果。
 * </p>
 *
 * @param <A> 属性记录类型
 */
@Data
public abstract class AgentObjectEntity<A extends AgentObjectAttributes> {

    /**
     * 对象名称
     */
    private String name;

    /**
     * 对象描述
     */
    private String description;

    /**
     * 属性记录
     */
    private A attributes;

    /**
     * 状态
     */
    private AgentObjectStatusEnum status;

    /**
     * 属性视图中有、属性表中没有的属性，原始字符串值，只读
     */
    @EqualsAndHashCode.Exclude
    private Map<String, String> unmappedAttributes = new LinkedHashMap<>();

    protected AgentObjectEntity() {
    }

    protected AgentObjectEntity(String name, String description, A attributes) {
        this.name = name;
        this.description = description;
        this.attributes = attributes;
    }

    public abstract AgentObjectTypeEnum getObjectType();
}
