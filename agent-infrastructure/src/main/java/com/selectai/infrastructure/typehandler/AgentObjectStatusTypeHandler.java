package com.selectai.infrastructure.typehandler;

import com.selectai.types.enums.AgentObjectStatusEnum;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * 视图状态列 (ENABLED / DISABLED) 与 {@link AgentObjectStatusEnum} 的映射处理器。
 */
@MappedTypes(AgentObjectStatusEnum.class)
public class AgentObjectStatusTypeHandler extends BaseTypeHandler<AgentObjectStatusEnum> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, AgentObjectStatusEnum parameter, JdbcType jdbcType) throws SQLException {
        // 过程参数使用小写编码
        ps.setString(i, parameter.getCode());
    }

    @Override
    public AgentObjectStatusEnum getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toStatus(rs.getString(columnName));
    }

    @Override
    public AgentObjectStatusEnum getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toStatus(rs.getString(columnIndex));
    }

    @Override
    public AgentObjectStatusEnum getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toStatus(cs.getString(columnIndex));
    }

    private AgentObjectStatusEnum toStatus(String value) throws SQLException {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return AgentObjectStatusEnum.fromCode(value);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Unsupported object status value: " + value, ex);
        }
    }
}
