package com.selectai.types.exception;

import com.selectai.types.enums.OracleErrorCodeEnum;
import lombok.Getter;

/**
 * 数据库侧返回的错误。
 * <p>
 * {@link #getCode()} 为 ORA-NNNNN 形式的错误码，{@link #getMessage()} 为数据库原始消息，
 * 调用方可直接按错误码子串匹配。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
@Getter
public class AgentDatabaseException extends AppException {

    private static final long serialVersionUID = -2468013579246801357L;

    /** 解码后的错误码 */
    private final OracleErrorCodeEnum oracleError;

    /** 数据库厂商错误码，如 20051 */
    private final int vendorCode;

    public AgentDatabaseException(int vendorCode, String message) {
        this(vendorCode, message, null);
    }

    public AgentDatabaseException(int vendorCode, String message, Throwable cause) {
        super(OracleErrorCodeEnum.formatCode(vendorCode), message, cause);
        this.vendorCode = vendorCode;
        this.oracleError = OracleErrorCodeEnum.fromVendorCode(vendorCode);
    }

    public boolean is(OracleErrorCodeEnum expected) {
        return oracleError == expected;
    }
}
