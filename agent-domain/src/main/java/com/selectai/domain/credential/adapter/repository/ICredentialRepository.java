package com.selectai.domain.credential.adapter.repository;

/**
 * 数据库凭据仓储 (DBMS_CLOUD)
 */
public interface ICredentialRepository {

    /**
     * 创建凭据；replace 为 true 时先删除同名凭据
     */
    void create(String credentialName, String username, String password, boolean replace);

    boolean exists(String credentialName);

    void delete(String credentialName);
}
