package com.sources.jobs.model;

import jakarta.persistence.*;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A capability attached to a {@link Source}. The reconciliation job reads and bumps
 * {@code retryCounter}; every other column belongs to the CRUD layer.
 */
@Entity
@Table(name = "applications", indexes = {
    @Index(name = "idx_applications_retry", columnList = "availability_status, retry_counter, created_at")
})
public class Application implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tenant_id", nullable = false)
    private Tenant tenant;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_id", nullable = false)
    private Source source;

    @Column(name = "application_type_id", nullable = false)
    private Long applicationTypeId;

    @Convert(converter = AvailabilityStatusConverter.class)
    @Column(name = "availability_status", length = 30)
    private AvailabilityStatus availabilityStatus;

    @Column(name = "retry_counter", nullable = false)
    private int retryCounter = 0; // bounded by RetryCreateJob.RETRY_MAX

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "application")
    private List<ApplicationAuthentication> applicationAuthentications = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
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

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Long getApplicationTypeId() {
        return applicationTypeId;
    }

    public void setApplicationTypeId(Long applicationTypeId) {
        this.applicationTypeId = applicationTypeId;
    }

    public AvailabilityStatus getAvailabilityStatus() {
        return availabilityStatus;
    }

    public void setAvailabilityStatus(AvailabilityStatus availabilityStatus) {
        this.availabilityStatus = availabilityStatus;
    }

    public int getRetryCounter() {
        return retryCounter;
    }

    public void setRetryCounter(int retryCounter) {
        this.retryCounter = retryCounter;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public List<ApplicationAuthentication> getApplicationAuthentications() {
        return applicationAuthentications;
    }

    public void setApplicationAuthentications(List<ApplicationAuthentication> applicationAuthentications) {
        this.applicationAuthentications = applicationAuthentications;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Application that = (Application) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Application{" +
               "id=" + id +
               ", applicationTypeId=" + applicationTypeId +
               ", availabilityStatus=" + availabilityStatus +
               ", retryCounter=" + retryCounter +
               ", createdAt=" + createdAt +
               '}';
    }
}
