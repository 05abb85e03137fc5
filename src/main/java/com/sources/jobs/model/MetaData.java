package com.sources.jobs.model;

import jakarta.persistence.*;

import java.io.Serializable;
import java.util.Objects;

/**
 * Per-application-type settings. Rows of type {@link #APP_META_DATA} hold feature flags such as
 * the retry-on-create opt-in.
 */
@Entity
@Table(name = "meta_data", indexes = {
    @Index(name = "idx_meta_data_app_type", columnList = "application_type_id, type")
})
public class MetaData implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String APP_META_DATA = "AppMetaData";
    public static final String SUPERKEY_META_DATA = "SuperKeyMetaData";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_type_id", nullable = false)
    private Long applicationTypeId;

    @Column(name = "type", nullable = false, length = 50)
    private String type;

    @Column(name = "name", nullable = false)
    private String name;

    @Lob
    @Column(name = "payload")
    private String payload;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getApplicationTypeId() {
        return applicationTypeId;
    }

    public void setApplicationTypeId(Long applicationTypeId) {
        this.applicationTypeId = applicationTypeId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetaData that = (MetaData) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "MetaData{" +
               "id=" + id +
               ", applicationTypeId=" + applicationTypeId +
               ", type='" + type + '\'' +
               ", name='" + name + '\'' +
               '}';
    }
}
