package com.selectai.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义客户端中使用的全局常量，如默认名称模式、参数键等通用配置。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 列表查询未指定名称模式时使用的正则 */
    public final static String MATCH_ALL_PATTERN = ".*";

    /** REGEXP_LIKE 匹配参数：忽略大小写 */
    public final static String REGEXP_MATCH_IGNORE_CASE = "i";

    /** Team 运行参数中的会话关联 ID */
    public final static String CONVERSATION_ID = "conversation_id";

}
