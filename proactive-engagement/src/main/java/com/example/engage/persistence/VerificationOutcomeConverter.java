package com.example.engage.persistence;

import com.example.engage.domain.VerificationOutcome;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class VerificationOutcomeConverter implements AttributeConverter<VerificationOutcome, String> {

    @Override
    public String convertToDatabaseColumn(VerificationOutcome attribute) {
        return attribute != null ? attribute.value() : null;
    }

    @Override
    public VerificationOutcome convertToEntityAttribute(String dbData) {
        return VerificationOutcome.fromValue(dbData);
    }
}
