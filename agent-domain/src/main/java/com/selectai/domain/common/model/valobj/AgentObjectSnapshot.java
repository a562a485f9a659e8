package com.selectai.domain.common.model.valobj;

import com.selectai.types.enums.AgentObjectStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 从数据库视图读取的对象原始快照，属性值保持视图中的字符串形式。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentObjectSnapshot {

    private String name;

    private String description;

    private AgentObjectStatusEnum status;

    /**
     * 属性名 → 原始属性值；仅按名称列表查询时为 null，需要单独加载
     */
    private Map<String, String> attributes;
}
