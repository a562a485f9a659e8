package com.selectai.types.enums;

/**
 * 数据库侧对象类型枚举。
 * <p>
 * 每种类型决定远程过程名（如 {@code DBMS_CLOUD_AI_AGENT.CREATE_TASK}）、
 * 名称参数、对象视图与属性视图。
 * 过程名与视图名只由这里的常量拼接，不接受外部输入。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
public enum AgentObjectTypeEnum {

    /**
     * AI Profile - DBMS_CLOUD_AI
     */
    PROFILE("profile", "Profile", "DBMS_CLOUD_AI", "PROFILE", "profile_name",
            "USER_CLOUD_AI_PROFILES", "USER_CLOUD_AI_PROFILE_ATTRIBUTES"),

    /**
     * Agent 工具
     */
    TOOL("tool", "Tool", "DBMS_CLOUD_AI_AGENT", "TOOL", "tool_name",
            "USER_AI_AGENT_TOOLS", "USER_AI_AGENT_TOOL_ATTRIBUTES"),

    /**
     * Agent 任务
     */
    TASK("task", "Task", "DBMS_CLOUD_AI_AGENT", "TASK", "task_name",
            "USER_AI_AGENT_TASKS", "USER_AI_AGENT_TASK_ATTRIBUTES"),

    /**
     * Agent
     */
    AGENT("agent", "Agent", "DBMS_CLOUD_AI_AGENT", "AGENT", "agent_name",
            "USER_AI_AGENTS", "USER_AI_AGENT_ATTRIBUTES"),

    /**
     * Agent 团队
     */
    TEAM("team", "Team", "DBMS_CLOUD_AI_AGENT", "TEAM", "team_name",
            "USER_AI_AGENT_TEAMS", "USER_AI_AGENT_TEAM_ATTRIBUTES");

    private final String code;
    private final String displayName;
    private final String procedurePackage;
    private final String procedureSuffix;
    private final String nameParameter;
    private final String objectView;
    private final String attributeView;

    AgentObjectTypeEnum(String code,
                        String displayName,
                        String procedurePackage,
                        String procedureSuffix,
                        String nameParameter,
                        String objectView,
                        String attributeView) {
        this.code = code;
        this.displayName = displayName;
        this.procedurePackage = procedurePackage;
        this.procedureSuffix = procedureSuffix;
        this.nameParameter = nameParameter;
        this.objectView = objectView;
        this.attributeView = attributeView;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNameParameter() {
        return nameParameter;
    }

    public String getObjectView() {
        return objectView;
    }

    public String getAttributeView() {
        return attributeView;
    }

    /**
     * 视图中的名称列，与名称参数同名。
     */
    public String getNameColumn() {
        return nameParameter;
    }

    /**
     * DBMS_CLOUD_AI_AGENT 的 SET_ATTRIBUTE(S) 需要 object_type 参数，DBMS_CLOUD_AI 不需要。
     */
    public boolean requiresObjectTypeParameter() {
        return this != PROFILE;
    }

    public String createProcedure() {
        return procedure("CREATE");
    }

    public String dropProcedure() {
        return procedure("DROP");
    }

    public String enableProcedure() {
        return procedure("ENABLE");
    }

    public String disableProcedure() {
        return procedure("DISABLE");
    }

    public String setAttributeProcedure() {
        return procedurePackage + ".SET_ATTRIBUTE";
    }

    public String setAttributesProcedure() {
        return procedurePackage + ".SET_ATTRIBUTES";
    }

    private String procedure(String verb) {
        return procedurePackage + "." + verb + "_" + procedureSuffix;
    }
}
