package com.selectai.infrastructure.dao;

import com.selectai.infrastructure.dao.po.CredentialPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 凭据 DAO (DBMS_CLOUD)
 *
 * @author selectai
 * @since 2025-06-10
 */
@Mapper
public interface CredentialDao {

    void create(CredentialPO po);

    void drop(@Param("credentialName") String credentialName);

    int countByName(@Param("credentialName") String credentialName);
}
