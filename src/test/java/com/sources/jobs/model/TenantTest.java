package com.sources.jobs.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.sources.jobs.JobJson;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TenantTest {

    @Test
    void headersCarryAccountOrgAndGeneratedIdentity() throws Exception {
        Tenant tenant = new Tenant();
        tenant.setExternalTenant("12345");
        tenant.setOrgId("org-1");

        List<ForwardableHeader> headers = tenant.forwardableHeaders();

        assertThat(headers).extracting(ForwardableHeader::key).containsExactly(
                ForwardableHeader.ACCOUNT_NUMBER, ForwardableHeader.ORG_ID, ForwardableHeader.IDENTITY);
        JsonNode identity = JobJson.MAPPER.readTree(Base64.getDecoder().decode(headers.get(2).value()));
        assertThat(identity.at("/identity/account_number").asText()).isEqualTo("12345");
        assertThat(identity.at("/identity/org_id").asText()).isEqualTo("org-1");
        assertThat(identity.at("/identity/internal/org_id").asText()).isEqualTo("org-1");
    }

    @Test
    void orgOnlyTenantHasNoAccountHeader() throws Exception {
        Tenant tenant = new Tenant();
        tenant.setOrgId("org-2");

        List<ForwardableHeader> headers = tenant.forwardableHeaders();

        assertThat(headers).extracting(ForwardableHeader::key)
                .containsExactly(ForwardableHeader.ORG_ID, ForwardableHeader.IDENTITY);
        JsonNode identity = JobJson.MAPPER.readTree(Base64.getDecoder().decode(headers.get(1).value()));
        assertThat(identity.at("/identity").has("account_number")).isFalse();
    }
}
