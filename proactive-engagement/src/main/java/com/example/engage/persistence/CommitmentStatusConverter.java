package com.example.engage.persistence;

import com.example.engage.domain.CommitmentStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class CommitmentStatusConverter implements AttributeConverter<CommitmentStatus, String> {

    @Override
    public String convertToDatabaseColumn(CommitmentStatus attribute) {
        return attribute != null ? attribute.value() : null;
    }

    @Override
    public CommitmentStatus convertToEntityAttribute(String dbData) {
        return CommitmentStatus.fromValue(dbData);
    }
}
