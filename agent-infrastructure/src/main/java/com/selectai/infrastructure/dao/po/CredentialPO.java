package com.selectai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * DBMS_CLOUD 凭据 PO
 *
 * @author selectai
 * @since 2025-06-10
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialPO {

    private String credentialName;

    private String username;

    @ToString.Exclude
    private String password;

    private Boolean replace;
}
