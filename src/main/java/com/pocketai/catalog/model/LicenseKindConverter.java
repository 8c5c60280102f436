package com.pocketai.catalog.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link LicenseKind} as its hub token ("apache-2.0") rather than the
 * enum constant name. Unrecognised stored values read back as UNKNOWN.
 */
@Converter
public class LicenseKindConverter implements AttributeConverter<LicenseKind, String> {

    @Override
    public String convertToDatabaseColumn(LicenseKind attribute) {
        return attribute == null ? LicenseKind.UNKNOWN.getToken() : attribute.getToken();
    }

    @Override
    public LicenseKind convertToEntityAttribute(String dbData) {
        LicenseKind kind = LicenseKind.fromToken(dbData);
        return kind == null ? LicenseKind.UNKNOWN : kind;
    }
}
