package com.sources.jobs.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link AvailabilityStatus} as its lowercase wire value; empty columns read back as {@code null}.
 */
@Converter
public class AvailabilityStatusConverter implements AttributeConverter<AvailabilityStatus, String> {

    @Override
    public String convertToDatabaseColumn(AvailabilityStatus attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public AvailabilityStatus convertToEntityAttribute(String dbData) {
        return AvailabilityStatus.fromValue(dbData);
    }
}
