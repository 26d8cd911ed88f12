package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.timerange.TimeRangeSet;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Empty sets are stored as NULL. */
@Converter
public class TimeRangeSetConverter implements AttributeConverter<TimeRangeSet, String> {
    @Override
    public String convertToDatabaseColumn(TimeRangeSet attribute) {
        return attribute == null || attribute.isEmpty() ? null : attribute.format();
    }

    @Override
    public TimeRangeSet convertToEntityAttribute(String dbData) {
        return TimeRangeSet.parse(dbData);
    }
}
