package com.sources.jobs.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sources.jobs.JobJson;
import jakarta.persistence.*;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * The isolation boundary every persisted resource belongs to.
 */
@Entity
@Table(name = "tenants")
public class Tenant implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_tenant")
    private String externalTenant; // account number, null for org-only tenants

    @Column(name = "org_id")
    private String orgId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Builds the headers that accompany events raised for this tenant outside of a request:
     * the account number and org id when present, plus an {@code x-rh-identity} generated from them.
     */
    public List<ForwardableHeader> forwardableHeaders() {
        List<ForwardableHeader> headers = new ArrayList<>(3);
        if (externalTenant != null && !externalTenant.isBlank()) {
            headers.add(new ForwardableHeader(ForwardableHeader.ACCOUNT_NUMBER, externalTenant));
        }
        if (orgId != null && !orgId.isBlank()) {
            headers.add(new ForwardableHeader(ForwardableHeader.ORG_ID, orgId));
        }
        headers.add(new ForwardableHeader(ForwardableHeader.IDENTITY, generateIdentity()));
        return headers;
    }

    private String generateIdentity() {
        ObjectNode root = JobJson.MAPPER.createObjectNode();
        ObjectNode identity = root.putObject("identity");
        if (externalTenant != null && !externalTenant.isBlank()) {
            identity.put("account_number", externalTenant);
        }
        if (orgId != null && !orgId.isBlank()) {
            identity.put("org_id", orgId);
            identity.putObject("internal").put("org_id", orgId);
        }
        try {
            byte[] json = JobJson.MAPPER.writeValueAsBytes(root);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to generate identity header for tenant " + id, e);
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getExternalTenant() {
        return externalTenant;
    }

    public void setExternalTenant(String externalTenant) {
        this.externalTenant = externalTenant;
    }

    public String getOrgId() {
        return orgId;
    }

    public void setOrgId(String orgId) {
        this.orgId = orgId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tenant that = (Tenant) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Tenant{" +
               "id=" + id +
               ", externalTenant='" + externalTenant + '\'' +
               ", orgId='" + orgId + '\'' +
               '}';
    }
}
