package com.selectai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 视图查询参数 PO。
 * <p>
 * objectView / attributeView / nameColumn 以文本拼入 SQL，只能取自对象类型枚举。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentObjectQueryPO {

    private String objectView;

    private String attributeView;

    private String nameColumn;

    /**
     * 精确名称
     */
    private String name;

    /**
     * 名称正则
     */
    private String pattern;

    /**
     * REGEXP_LIKE 匹配参数
     */
    private String matchParameter;
}
