package com.selectai.infrastructure.repository;

import com.selectai.domain.credential.adapter.repository.ICredentialRepository;
import com.selectai.infrastructure.dao.CredentialDao;
import com.selectai.infrastructure.dao.po.CredentialPO;
import com.selectai.infrastructure.util.OracleErrorTranslator;
import org.springframework.stereotype.Repository;

/**
 * 凭据仓储实现类
 *
 * @author selectai
 * @since 2025-06-10
 */
@Repository
public class CredentialRepositoryImpl implements ICredentialRepository {

    private final CredentialDao credentialDao;
    private final OracleErrorTranslator oracleErrorTranslator;

    public CredentialRepositoryImpl(CredentialDao credentialDao, OracleErrorTranslator oracleErrorTranslator) {
        this.credentialDao = credentialDao;
        this.oracleErrorTranslator = oracleErrorTranslator;
    }

    @Override
    public void create(String credentialName, String username, String password, boolean replace) {
        CredentialPO po = CredentialPO.builder()
                .credentialName(credentialName)
                .username(username)
                .password(password)
                .replace(replace)
                .build();
        try {
            credentialDao.create(po);
        } catch (RuntimeException ex) {
            throw oracleErrorTranslator.translate(ex);
        }
    }

    @Override
    public boolean exists(String credentialName) {
        try {
            return credentialDao.countByName(credentialName) > 0;
        } catch (RuntimeException ex) {
            throw oracleErrorTranslator.translate(ex);
        }
    }

    @Override
    public void delete(String credentialName) {
        try {
            credentialDao.drop(credentialName);
        } catch (RuntimeException ex) {
            throw oracleErrorTranslator.translate(ex);
        }
    }
}
