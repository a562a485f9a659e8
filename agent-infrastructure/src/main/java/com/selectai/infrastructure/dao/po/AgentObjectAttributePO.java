package com.selectai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 属性视图行 PO
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentObjectAttributePO {

    private String attributeName;

    /**
     * 属性值 (CLOB)，列表与对象为 JSON 文本
     */
    private String attributeValue;
}
