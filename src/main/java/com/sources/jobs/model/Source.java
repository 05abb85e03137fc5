package com.sources.jobs.model;

import jakarta.persistence.*;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A connected external platform or account. Only the columns the job subsystem reads are mapped.
 */
@Entity
@Table(name = "sources")
public class Source implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Creation workflow of sources whose applications are provisioned through superkey. */
    public static final String ACCOUNT_AUTHORIZATION = "account_authorization";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tenant_id", nullable = false)
    private Tenant tenant;

    @Column(nullable = false)
    private String name;

    @Column(name = "app_creation_workflow", length = 50)
    private String appCreationWorkflow;

    @Convert(converter = AvailabilityStatusConverter.class)
    @Column(name = "availability_status", length = 30)
    private AvailabilityStatus availabilityStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean isSuperkey() {
        return ACCOUNT_AUTHORIZATION.equals(appCreationWorkflow);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Tenant getTenant() {
        return tenant;
    }

    public void setTenant(Tenant tenant) {
        this.tenant = tenant;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAppCreationWorkflow() {
        return appCreationWorkflow;
    }

    public void setAppCreationWorkflow(String appCreationWorkflow) {
        this.appCreationWorkflow = appCreationWorkflow;
    }

    public AvailabilityStatus getAvailabilityStatus() {
        return availabilityStatus;
    }

    public void setAvailabilityStatus(AvailabilityStatus availabilityStatus) {
        this.availabilityStatus = availabilityStatus;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Source that = (Source) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Source{" +
               "id=" + id +
               ", name='" + name + '\'' +
               ", appCreationWorkflow='" + appCreationWorkflow + '\'' +
               ", availabilityStatus=" + availabilityStatus +
               '}';
    }
}
