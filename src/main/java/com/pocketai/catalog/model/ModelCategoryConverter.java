package com.pocketai.catalog.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ModelCategoryConverter implements AttributeConverter<ModelCategory, String> {

    @Override
    public String convertToDatabaseColumn(ModelCategory attribute) {
        return attribute == null ? null : attribute.getToken();
    }

    @Override
    public ModelCategory convertToEntityAttribute(String dbData) {
        return ModelCategory.fromToken(dbData);
    }
}
