package com.selectai.domain.credential.service;

import com.selectai.domain.credential.adapter.repository.ICredentialRepository;
import com.selectai.types.enums.ResponseCode;
import com.selectai.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 凭据服务，供 Profile、Tool 通过 credential_name 引用。
 * 密码只传给数据库，不记录日志。
 */
@Slf4j
@Service
public class CredentialService {

    private final ICredentialRepository credentialRepository;

    public CredentialService(ICredentialRepository credentialRepository) {
        this.credentialRepository = credentialRepository;
    }

    public void create(String credentialName, String username, String password, boolean replace) {
        requireName(credentialName);
        if (StringUtils.isBlank(username)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Credential username cannot be empty");
        }
        if (StringUtils.isEmpty(password)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Credential password cannot be empty");
        }
        credentialRepository.create(credentialName, username, password, replace);
        log.info("Credential created. name={}, username={}, replace={}", credentialName, username, replace);
    }

    /**
     * 删除凭据。force 为 true 时凭据不存在也不报错。
     */
    public void delete(String credentialName, boolean force) {
        requireName(credentialName);
        if (force && !credentialRepository.exists(credentialName)) {
            log.info("Credential not found, skip delete. name={}", credentialName);
            return;
        }
        credentialRepository.delete(credentialName);
        log.info("Credential deleted. name={}", credentialName);
    }

    private void requireName(String credentialName) {
        if (StringUtils.isBlank(credentialName)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Credential name cannot be empty");
        }
    }
}
