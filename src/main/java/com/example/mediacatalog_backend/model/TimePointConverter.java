package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.timerange.TimePoint;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class TimePointConverter implements AttributeConverter<TimePoint, String> {
    @Override
    public String convertToDatabaseColumn(TimePoint attribute) {
        return attribute == null ? null : attribute.toString();
    }

    @Override
    public TimePoint convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TimePoint.parse(dbData);
    }
}
