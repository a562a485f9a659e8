package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 指定名称的对象不存在。各对象类型有各自的子类，便于调用方按类型捕获。
 *
 * @author selectai
 * @since 2025-06-10
 */
@Getter
public class AgentObjectNotFoundException extends AppException {

    private static final long serialVersionUID = -6623471083344470920L;

    private final AgentObjectTypeEnum objectType;

    private final String objectName;

    public AgentObjectNotFoundException(AgentObjectTypeEnum objectType, String objectName) {
        super(ResponseCode.NOT_FOUND, objectType.getDisplayName() + " " + objectName + " not found");
        this.objectType = objectType;
        this.objectName = objectName;
    }

    /**
     * 操作已删除对象时由数据库错误转换而来，保留原始 ORA 错误码与消息。
     *
     * @param cause 数据库侧错误
     */
    public AgentObjectNotFoundException(AgentObjectTypeEnum objectType, String objectName, AgentDatabaseException cause) {
        super(cause.getCode(), cause.getMessage(), cause);
        this.objectType = objectType;
        this.objectName = objectName;
    }
}
