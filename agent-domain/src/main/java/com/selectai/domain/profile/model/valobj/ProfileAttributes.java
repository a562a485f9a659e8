package com.selectai.domain.profile.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.selectai.domain.common.model.valobj.AgentObjectAttributes;
import com.selectai.domain.common.model.valobj.AttributeSchema;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.exception.AttributeValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

import static com.selectai.types.enums.AttributeTypeEnum.BOOLEAN;
import static com.selectai.types.enums.AttributeTypeEnum.INTEGER;
import static com.selectai.types.enums.AttributeTypeEnum.NUMBER;
import static com.selectai.types.enums.AttributeTypeEnum.OBJECT_LIST;
import static com.selectai.types.enums.AttributeTypeEnum.STRING;
import static com.selectai.types.enums.AttributeTypeEnum.STRING_LIST;

/**
 * AI Profile 属性，对应 DBMS_CLOUD_AI.CREATE_PROFILE 的 attributes。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileAttributes implements AgentObjectAttributes {

    public static final AttributeSchema SCHEMA = AttributeSchema.builder(AgentObjectTypeEnum.PROFILE)
            .optional("provider", STRING,
                    "oci", "openai", "cohere", "azure", "database", "google", "anthropic", "huggingface", "aws")
            .optional("model", STRING)
            .optional("embedding_model", STRING)
            .optional("region", STRING)
            .optional("oci_compartment_id", STRING)
            .optional("oci_apiformat", STRING)
            .optional("oci_runtimetype", STRING)
            .optional("oci_endpoint_id", STRING)
            .optional("azure_resource_name", STRING)
            .optional("azure_deployment_name", STRING)
            .optional("azure_embedding_deployment_name", STRING)
            .optional("aws_apiformat", STRING)
            .optional("provider_endpoint", STRING)
            .optional("credential_name", STRING)
            .optional("object_list", OBJECT_LIST)
            .optional("object_list_mode", STRING)
            .optional("vector_index_name", STRING)
            .optional("max_tokens", INTEGER)
            .optional("temperature", NUMBER)
            .optional("seed", INTEGER)
            .optional("stop_tokens", STRING_LIST)
            .optional("comments", BOOLEAN)
            .optional("conversation", BOOLEAN)
            .optional("annotations", BOOLEAN)
            .optional("constraints", BOOLEAN)
            .optional("enforce_object_list", BOOLEAN)
            .optional("case_sensitive_values", BOOLEAN)
            .optional("enable_sources", BOOLEAN)
            .optional("enable_source_offsets", BOOLEAN)
            .build();

    /** AI 服务提供商，如 oci、openai */
    private String provider;

    private String model;

    private String embeddingModel;

    private String region;

    private String ociCompartmentId;

    private String ociApiformat;

    private String ociRuntimetype;

    /** OCI 专用推理端点 */
    private String ociEndpointId;

    /** provider 为 azure 时必填 */
    private String azureResourceName;

    private String azureDeploymentName;

    private String azureEmbeddingDeploymentName;

    private String awsApiformat;

    /** 自定义服务端点，与 provider 二选一 */
    private String providerEndpoint;

    /** 访问 AI 服务的凭据名 */
    private String credentialName;

    private List<ProfileObjectRef> objectList;

    private String objectListMode;

    private String vectorIndexName;

    private Integer maxTokens;

    private Double temperature;

    private Integer seed;

    private List<String> stopTokens;

    private Boolean comments;

    private Boolean conversation;

    private Boolean annotations;

    private Boolean constraints;

    private Boolean enforceObjectList;

    private Boolean caseSensitiveValues;

    private Boolean enableSources;

    private Boolean enableSourceOffsets;

    @Override
    public void validate() {
        if (StringUtils.isBlank(provider) && StringUtils.isBlank(providerEndpoint)) {
            throw new AttributeValidationException(AgentObjectTypeEnum.PROFILE, "provider",
                    "Profile: either 'provider' or 'provider_endpoint' is required");
        }
        if ("azure".equals(provider) && StringUtils.isBlank(azureResourceName)) {
            throw new AttributeValidationException(AgentObjectTypeEnum.PROFILE, "azure_resource_name",
                    "Profile: 'azure_resource_name' is required for provider 'azure'");
        }
    }
}
