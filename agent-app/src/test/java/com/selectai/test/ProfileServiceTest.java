package com.selectai.test;

import com.selectai.domain.profile.model.entity.ProfileEntity;
import com.selectai.domain.profile.model.valobj.ProfileAttributes;
import com.selectai.domain.profile.model.valobj.ProfileObjectRef;
import com.selectai.test.support.AgentObjectServiceFixture;
import com.selectai.types.enums.AgentObjectStatusEnum;
import com.selectai.types.enums.AgentObjectTypeEnum;
import com.selectai.types.exception.AgentDatabaseException;
import com.selectai.types.exception.AttributeValidationException;
import com.selectai.types.exception.ProfileNotFoundException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

public class ProfileServiceTest {

    private final AgentObjectServiceFixture fixture = new AgentObjectServiceFixture();

    @Test
    public void shouldRoundTripAttributesThroughFetch() {
        ProfileAttributes attributes = ProfileAttributes.builder()
                .provider("oci")
                .credentialName("OCI_CRED")
                .model("meta.llama-3.1-70b-instruct")
                .objectList(List.of(ProfileObjectRef.builder().owner("SH").name("SALES").build()))
                .maxTokens(512)
                .temperature(0.3)
                .stopTokens(List.of("END"))
                .conversation(true)
                .build();
        fixture.profileService.create(new ProfileEntity("PYSAI_PROFILE", "demo profile", attributes));

        ProfileEntity fetched = fixture.profileService.fetch("PYSAI_PROFILE");

        Assertions.assertEquals("PYSAI_PROFILE", fetched.getName());
        Assertions.assertEquals("demo profile", fetched.getDescription());
        Assertions.assertEquals(attributes, fetched.getAttributes());
        Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, fetched.getStatus());
    }

    @Test
    public void shouldRoundTripAzureProviderAttributes() {
        ProfileAttributes attributes = ProfileAttributes.builder()
                .provider("azure")
                .credentialName("AZURE_CRED")
                .azureResourceName("res")
                .azureDeploymentName("dep")
                .azureEmbeddingDeploymentName("emb")
                .objectListMode("automated")
                .enableSourceOffsets(true)
                .build();
        ProfileEntity profile = new ProfileEntity("AZ", null, attributes);
        fixture.profileService.create(profile);

        Assertions.assertEquals(attributes, fixture.profileService.fetch("AZ").getAttributes());

        fixture.profileService.setAttribute(profile, "azure_resource_name", "res2");
        ProfileEntity fetched = fixture.profileService.fetch("AZ");
        Assertions.assertEquals("res2", fetched.getAttributes().getAzureResourceName());
        Assertions.assertEquals("dep", fetched.getAttributes().getAzureDeploymentName());
        Assertions.assertTrue(fetched.getUnmappedAttributes().isEmpty());
    }

    @Test
    public void shouldRequireResourceNameForAzure() {
        ProfileEntity profile = new ProfileEntity("AZ2", null, ProfileAttributes.builder().provider("azure").build());

        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.profileService.create(profile));
        Assertions.assertEquals(0, fixture.repository.getWriteCalls());
    }

    @Test
    public void shouldExposeAttributesOutsideSchemaOnFetch() {
        fixture.profileService.create(new ProfileEntity("RAW", null, ProfileAttributes.builder().provider("oci").build()));
        fixture.repository.setAttribute(AgentObjectTypeEnum.PROFILE, "RAW", "vendor_extension", "on");

        ProfileEntity fetched = fixture.profileService.fetch("RAW");

        Assertions.assertEquals("oci", fetched.getAttributes().getProvider());
        Assertions.assertEquals("on", fetched.getUnmappedAttributes().get("vendor_extension"));
    }

    @Test
    public void shouldRejectDuplicateUnlessReplace() {
        ProfileEntity first = new ProfileEntity("P1", null, ProfileAttributes.builder().provider("oci").model("a").build());
        fixture.profileService.create(first);

        ProfileEntity second = new ProfileEntity("P1", null, ProfileAttributes.builder().provider("openai").build());
        AgentDatabaseException ex = Assertions.assertThrows(AgentDatabaseException.class,
                () -> fixture.profileService.create(second));
        Assertions.assertEquals("ORA-20046", ex.getCode());

        fixture.profileService.create(second, true, true);
        ProfileAttributes replaced = fixture.profileService.fetch("P1").getAttributes();
        Assertions.assertEquals("openai", replaced.getProvider());
        Assertions.assertNull(replaced.getModel());
    }

    @Test
    public void shouldRequireProviderOrEndpoint() {
        ProfileEntity profile = new ProfileEntity("P2", null, ProfileAttributes.builder().model("x").build());

        Assertions.assertThrows(AttributeValidationException.class, () -> fixture.profileService.create(profile));
        Assertions.assertEquals(0, fixture.repository.getWriteCalls());
    }

    @Test
    public void shouldRaiseNotFoundForMissingProfile() {
        ProfileNotFoundException ex = Assertions.assertThrows(ProfileNotFoundException.class,
                () -> fixture.profileService.fetch("MISSING"));

        Assertions.assertEquals("MISSING", ex.getObjectName());
        Assertions.assertNull(fixture.profileService.getStatus("MISSING"));
    }

    @Test
    public void shouldCreateDisabledAndToggle() {
        ProfileEntity profile = new ProfileEntity("P3", null, ProfileAttributes.builder().provider("oci").build());
        fixture.profileService.create(profile, false, false);
        Assertions.assertEquals(AgentObjectStatusEnum.DISABLED, fixture.profileService.getStatus("P3"));

        fixture.profileService.enable(profile);
        Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, profile.getStatus());
        Assertions.assertEquals(AgentObjectStatusEnum.ENABLED, fixture.profileService.getStatus("P3"));
    }

    @Test
    public void shouldUpdateSingleAttributeAndKeepOthers() {
        ProfileEntity profile = new ProfileEntity("P4", null,
                ProfileAttributes.builder().provider("oci").model("a").build());
        fixture.profileService.create(profile);

        fixture.profileService.setAttribute(profile, "MODEL", "b");

        ProfileAttributes fetched = fixture.profileService.fetch("P4").getAttributes();
        Assertions.assertEquals("b", fetched.getModel());
        Assertions.assertEquals("oci", fetched.getProvider());
        Assertions.assertEquals("b", profile.getAttributes().getModel());
    }

    @Test
    public void shouldLeaveStateUntouchedWhenSetAttributeRejected() {
        ProfileEntity profile = new ProfileEntity("P5", null,
                ProfileAttributes.builder().provider("oci").model("a").build());
        fixture.profileService.create(profile);
        int calls = fixture.repository.getWriteCalls();

        Assertions.assertThrows(AttributeValidationException.class,
                () -> fixture.profileService.setAttribute(profile, "model", ""));
        Assertions.assertThrows(AttributeValidationException.class,
                () -> fixture.profileService.setAttribute(profile, "model", null));
        Assertions.assertThrows(AttributeValidationException.class,
                () -> fixture.profileService.setAttribute(profile, "unknown_key", "x"));

        Assertions.assertEquals(calls, fixture.repository.getWriteCalls());
        Assertions.assertEquals("a", profile.getAttributes().getModel());
        Assertions.assertEquals("a", fixture.profileService.fetch("P5").getAttributes().getModel());
    }

    @Test
    public void shouldReplaceWholeRecordWithSetAttributes() {
        ProfileEntity profile = new ProfileEntity("P6", null,
                ProfileAttributes.builder().provider("oci").region("us-chicago-1").build());
        fixture.profileService.create(profile);

        ProfileAttributes next = ProfileAttributes.builder().provider("openai").model("gpt-4o").build();
        fixture.profileService.setAttributes(profile, next);

        Assertions.assertEquals(next, fixture.profileService.fetch("P6").getAttributes());
        Assertions.assertEquals(next, profile.getAttributes());
    }

    @Test
    public void shouldListLazilyByPattern() {
        for (String name : List.of("PYSAI_A", "PYSAI_B", "OTHER")) {
            fixture.profileService.create(new ProfileEntity(name, null, ProfileAttributes.builder().provider("oci").build()));
        }

        List<String> names = fixture.profileService.list("^pysai_")
                .map(ProfileEntity::getName)
                .collect(Collectors.toList());

        Assertions.assertEquals(List.of("PYSAI_A", "PYSAI_B"), names);
        Assertions.assertEquals(3, fixture.profileService.list().count());
        Assertions.assertEquals(3, fixture.profileService.list("").count());
    }

    @Test
    public void shouldRejectOperationsAfterDelete() {
        ProfileEntity profile = new ProfileEntity("P7", null, ProfileAttributes.builder().provider("oci").build());
        fixture.profileService.create(profile);
        fixture.profileService.delete(profile, true);

        Assertions.assertNull(profile.getStatus());
        Assertions.assertNull(fixture.repository.findStatus(AgentObjectTypeEnum.PROFILE, "P7"));
        ProfileNotFoundException enable = Assertions.assertThrows(ProfileNotFoundException.class,
                () -> fixture.profileService.enable(profile));
        Assertions.assertEquals("ORA-20046", enable.getCode());
        Assertions.assertInstanceOf(AgentDatabaseException.class, enable.getCause());
        Assertions.assertThrows(ProfileNotFoundException.class, () -> fixture.profileService.disable(profile));
        Assertions.assertThrows(ProfileNotFoundException.class,
                () -> fixture.profileService.setAttribute(profile, "model", "x"));
        Assertions.assertThrows(ProfileNotFoundException.class,
                () -> fixture.profileService.setAttributes(profile, ProfileAttributes.builder().provider("oci").build()));
        Assertions.assertThrows(ProfileNotFoundException.class, () -> fixture.profileService.delete(profile));
        Assertions.assertThrows(ProfileNotFoundException.class, () -> fixture.profileService.fetch("P7"));
    }
}
