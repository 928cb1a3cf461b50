package com.example.engage.persistence;

import com.example.engage.domain.EngagementStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class EngagementStatusConverter implements AttributeConverter<EngagementStatus, String> {

    @Override
    public String convertToDatabaseColumn(EngagementStatus attribute) {
        return attribute != null ? attribute.value() : null;
    }

    @Override
    public EngagementStatus convertToEntityAttribute(String dbData) {
        return EngagementStatus.fromValue(dbData);
    }
}
