package com.selectai.infrastructure.util;

import com.selectai.types.exception.AgentDatabaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.SQLException;

/**
 * 数据库异常转换：沿异常链找到 {@link SQLException}，以其厂商错误码和原始消息构造
 * {@link AgentDatabaseException}。没有 SQLException 的异常原样返回。
 */
@Slf4j
@Component
public class OracleErrorTranslator {

    public RuntimeException translate(RuntimeException ex) {
        if (ex instanceof AgentDatabaseException) {
            return ex;
        }
        SQLException sqlException = findSqlException(ex);
        if (sqlException == null) {
            return ex;
        }
        AgentDatabaseException translated = new AgentDatabaseException(
                sqlException.getErrorCode(), sqlException.getMessage(), ex);
        log.debug("Database call failed. code={}, message={}", translated.getCode(), translated.getMessage());
        return translated;
    }

    private SQLException findSqlException(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
