package com.selectai.types.exception;

import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 属性校验失败，在发起远程调用前抛出，不会修改任何状态。
 *
 * @author selectai
 * @since 2025-06-10
 */
@Getter
public class AttributeValidationException extends AppException {

    private static final long serialVersionUID = 7261937461027364519L;

    private final AgentObjectTypeEnum objectType;

    /** 出错的属性名，非单属性错误时为 null */
    private final String attributeName;

    public AttributeValidationException(AgentObjectTypeEnum objectType, String attributeName, String message) {
        super(ResponseCode.ILLEGAL_PARAMETER, message);
        this.objectType = objectType;
        this.attributeName = attributeName;
    }
}
