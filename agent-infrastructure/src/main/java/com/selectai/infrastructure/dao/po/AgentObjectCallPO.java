package com.selectai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 过程调用参数 PO。
 * <p>
 * procedure、dropProcedure、nameParameter、objectView、nameColumn 以文本拼入 PL/SQL 块，
 * 只能取自对象类型枚举；其余字段均作为绑定变量传入。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentObjectCallPO {

    /**
     * 完整过程名，如 DBMS_CLOUD_AI_AGENT.CREATE_TASK
     */
    private String procedure;

    /**
     * replace 创建时使用的删除过程
     */
    private String dropProcedure;

    /**
     * 名称参数名，如 task_name
     */
    private String nameParameter;

    private String objectView;

    private String nameColumn;

    /**
     * SET_ATTRIBUTE(S) 的 object_type 参数，为 null 时不传
     */
    private String objectType;

    private String name;

    private String description;

    /**
     * 属性 JSON
     */
    private String attributes;

    /**
     * enabled / disabled
     */
    private String status;

    private String attributeName;

    private String attributeValue;

    private Boolean force;

    private Boolean replace;
}
